package com.adinsight.anomaly.model;

public enum Industry {
    ECOMMERCE,
    FOOD_BEVERAGE,
    FASHION,
    BEAUTY,
    EDUCATION,
    SAAS
}
