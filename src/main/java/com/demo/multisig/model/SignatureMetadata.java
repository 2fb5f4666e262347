package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Device details a signer optionally attaches to its signature. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignatureMetadata(String deviceId, String deviceInfo, String userAgent) {
}
