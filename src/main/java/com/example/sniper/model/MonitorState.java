package com.example.sniper.model;

public enum MonitorState { STOPPED, RUNNING }
