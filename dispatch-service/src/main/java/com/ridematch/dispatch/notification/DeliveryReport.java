package com.ridematch.dispatch.notification;

public record DeliveryReport(int delivered, int failed) {
}
