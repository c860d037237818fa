package com.example.sniper.model;

public enum ActivityType { SYSTEM, ERROR, FOUND, SNIPE, BOOKED, WATCH }
