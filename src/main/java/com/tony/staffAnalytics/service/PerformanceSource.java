package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.PerformanceKey;

import java.util.OptionalDouble;

/**
 * Une source de composite de performance (victoires, EPA, WAR...).
 */
public interface PerformanceSource {

    String name();

    OptionalDouble lookup(PerformanceKey key);
}
