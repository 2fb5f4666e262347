package com.demo.multisig.controller.dto;

import jakarta.validation.constraints.Email;

/** HTTP fallback for devices that cannot hold a socket open. */
public final class DeviceDtos {

    private DeviceDtos() {}

    public static class RegisterRequest {
        public String deviceId;
        public String platform;
        public String pushToken;
        @Email
        public String email;
        public String phone;
    }
}
