package com.keystone.core.model;

public enum SchemaCheck {
    PASS,
    FAIL
}
