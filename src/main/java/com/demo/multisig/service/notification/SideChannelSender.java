package com.demo.multisig.service.notification;

public interface SideChannelSender {

    ChannelType type();

    void send(ChannelRegistration registration, NotificationMessage message);
}
