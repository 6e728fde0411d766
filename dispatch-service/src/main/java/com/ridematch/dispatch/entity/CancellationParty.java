package com.ridematch.dispatch.entity;

public enum CancellationParty {
    RIDER,
    DRIVER
}
