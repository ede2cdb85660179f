package com.poc.eurverifier.engine;

public enum Currency {
    BGN,
    EUR
}
