package com.shecares.notification.service;

public record EmailMessage(String to, String subject, String text) {}
