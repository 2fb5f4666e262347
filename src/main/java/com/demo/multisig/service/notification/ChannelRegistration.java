package com.demo.multisig.service.notification;

/** A user's address on one side channel: push token, e-mail address or phone number. */
public record ChannelRegistration(ChannelType type, String endpoint, String deviceId, String platform) {
}
