package com.platform.failover.model;

public enum ProbeType {
    HTTP,
    TCP
}
