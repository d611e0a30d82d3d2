package com.example.broken;

public class Broken {
    private int value;

    public int getValue() {
        return value;
    }
