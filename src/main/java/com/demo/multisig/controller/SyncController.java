package com.demo.multisig.controller;

import com.demo.multisig.controller.dto.DeviceDtos;
import com.demo.multisig.service.ResyncService;
import com.demo.multisig.service.ResyncSnapshot;
import com.demo.multisig.service.notification.ChannelRegistration;
import com.demo.multisig.service.notification.ChannelType;
import com.demo.multisig.service.notification.NotificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Pull-based recovery and side-channel registration for devices without a live socket. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SyncController {

    private final ResyncService resyncService;
    private final NotificationService notificationService;

    @GetMapping("/sync")
    public ResyncSnapshot resync(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return resyncService.resync(userId);
    }

    @PostMapping("/devices")
    public Map<String, Object> registerDevice(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                              @Valid @RequestBody DeviceDtos.RegisterRequest body) {
        List<String> registered = new ArrayList<>();
        if (StringUtils.hasText(body.pushToken)) {
            notificationService.registerChannel(userId,
                    new ChannelRegistration(ChannelType.PUSH, body.pushToken, body.deviceId, body.platform));
            registered.add(ChannelType.PUSH.wire());
        }
        if (StringUtils.hasText(body.email)) {
            notificationService.registerChannel(userId,
                    new ChannelRegistration(ChannelType.EMAIL, body.email, body.deviceId, body.platform));
            registered.add(ChannelType.EMAIL.wire());
        }
        if (StringUtils.hasText(body.phone)) {
            notificationService.registerChannel(userId,
                    new ChannelRegistration(ChannelType.SMS, body.phone, body.deviceId, body.platform));
            registered.add(ChannelType.SMS.wire());
        }
        return Map.of("userId", userId, "channels", registered);
    }

    @PostMapping("/notifications/{id}/read")
    public Map<String, Object> markRead(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                        @PathVariable("id") String notificationId) {
        return Map.of("id", notificationId, "read", notificationService.markAsRead(userId, notificationId));
    }
}
