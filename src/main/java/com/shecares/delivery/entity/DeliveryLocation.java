package com.shecares.delivery.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryLocation {

    private static final String DEFAULT_COUNTRY = "Nigeria";

    @Column(name = "location_street")
    private String street;

    @Column(name = "location_city")
    private String city;

    @Column(name = "location_state")
    private String state;

    @Column(name = "location_country")
    private String country;

    @Column(name = "location_postal_code")
    private String postalCode;

    @Column(name = "location_landmark")
    private String landmark;

    @Column(name = "location_latitude")
    private Double latitude;

    @Column(name = "location_longitude")
    private Double longitude;

    @Builder
    public DeliveryLocation(String street, String city, String state, String country,
                            String postalCode, String landmark, Double latitude, Double longitude) {
        this.street = street;
        this.city = city;
        this.state = state;
        this.country = country != null ? country : DEFAULT_COUNTRY;
        this.postalCode = postalCode;
        this.landmark = landmark;
        this.latitude = latitude;
        this.longitude = longitude;
    }
}
