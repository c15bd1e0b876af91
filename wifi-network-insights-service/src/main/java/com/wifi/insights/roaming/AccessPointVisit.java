package com.wifi.insights.roaming;

/** An access point seen on a trail and how many trail events it had. */
public record AccessPointVisit(String apName, int eventCount) {}
