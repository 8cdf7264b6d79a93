package com.visaeligibility.model;

public enum FactType {
    NUMBER,
    STRING,
    BOOLEAN,
    DATE
}
