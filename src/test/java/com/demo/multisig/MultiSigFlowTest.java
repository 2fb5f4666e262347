package com.demo.multisig;

import com.demo.multisig.controller.RequestHeaders;
import com.demo.multisig.service.CanonicalPayload;
import com.demo.multisig.service.ExecutionBroadcaster;
import com.demo.multisig.service.GasPriceOracle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class MultiSigFlowTest {

    private static final String TO = "0x00000000000000000000000000000000000abc00";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ExecutionBroadcaster broadcaster;

    @MockBean
    private GasPriceOracle gasPriceOracle;

    @Test
    void twoOfTwoProposalExecutesOnceAndReachesEveryDevice() throws Exception {
        when(gasPriceOracle.currentGasPrice()).thenReturn(BigInteger.valueOf(1_000_000_000L));
        when(broadcaster.execute(any())).thenReturn("0xabc");

        KeyPair aliceKey = p256();
        KeyPair bobKey = p256();
        assertThat(call(HttpMethod.POST, "/api/validators", "alice", passkey("flow-a", aliceKey)).getStatusCode())
                .isEqualTo(HttpStatus.CREATED);
        assertThat(call(HttpMethod.POST, "/api/validators", "bob", passkey("flow-b", bobKey)).getStatusCode())
                .isEqualTo(HttpStatus.CREATED);

        BlockingQueue<String> bobFrames = new LinkedBlockingQueue<>();
        WebSocketSession socket = new StandardWebSocketClient().execute(new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                bobFrames.add(message.getPayload());
            }
        }, "ws://localhost:{port}/ws/notifications?userId=bob", port).get(5, TimeUnit.SECONDS);
        try {
            assertThat(bobFrames.poll(5, TimeUnit.SECONDS)).contains("connection_established");

            ResponseEntity<String> created = call(HttpMethod.POST, "/api/multisig/proposals", "alice", Map.of(
                    "to", TO,
                    "value", "0.25",
                    "requiredSignatures", 2,
                    "validatorIds", new String[]{"flow-a", "flow-b"},
                    "metadata", Map.of("title", "Team lunch")));
            assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            String id = json(created).get("id").asText();

            assertThat(awaitFrame(bobFrames, "new_proposal_" + id)).contains("Team lunch requires 2 signature(s).");

            JsonNode first = json(call(HttpMethod.POST, "/api/multisig/proposals/" + id + "/sign", "alice",
                    signRequest(id, "flow-a", aliceKey)));
            assertThat(first.get("executed").asBoolean()).isFalse();
            assertThat(first.get("proposal").get("collectedSignatures").asInt()).isEqualTo(1);

            JsonNode second = json(call(HttpMethod.POST, "/api/multisig/proposals/" + id + "/sign", "bob",
                    signRequest(id, "flow-b", bobKey)));
            assertThat(second.get("executed").asBoolean()).isTrue();
            assertThat(second.get("transactionHash").asText()).isEqualTo("0xabc");
            verify(broadcaster).execute(any());

            assertThat(awaitFrame(bobFrames, "proposal_executed_" + id)).contains("0xabc");

            ResponseEntity<String> again = call(HttpMethod.POST, "/api/multisig/proposals/" + id + "/sign", "bob",
                    signRequest(id, "flow-b", bobKey));
            assertThat(again.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(json(again).get("code").asText()).isEqualTo("NOT_PENDING");

            ResponseEntity<String> outsider = call(HttpMethod.GET, "/api/multisig/proposals/" + id, "carol", null);
            assertThat(outsider.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

            // a device that was never connected recovers the same outcome by pulling
            JsonNode sync = json(call(HttpMethod.GET, "/api/sync", "alice", null));
            assertThat(sync.get("pendingProposals").size()).isZero();
            assertThat(sync.get("recentNotifications").get(0).get("notification").get("id").asText())
                    .isEqualTo("proposal_executed_" + id);
        } finally {
            socket.close();
        }
    }

    @Test
    void requestWithoutUserHeaderIsRejected() {
        ResponseEntity<String> response = rest.getForEntity("/api/multisig/proposals", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    private ResponseEntity<String> call(HttpMethod method, String path, String userId, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(RequestHeaders.USER_ID, userId);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.exchange(path, method, new HttpEntity<>(body, headers), String.class);
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    private static String awaitFrame(BlockingQueue<String> frames, String notificationId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            String frame = frames.poll(250, TimeUnit.MILLISECONDS);
            if (frame != null && frame.contains("\"" + notificationId + "\"")) {
                return frame;
            }
        }
        throw new AssertionError("No frame for " + notificationId);
    }

    private static Map<String, Object> passkey(String id, KeyPair key) {
        return Map.of(
                "id", id,
                "kind", "passkey",
                "name", "Laptop",
                "publicKey", Base64.getEncoder().encodeToString(key.getPublic().getEncoded()),
                "metadata", Map.of("kind", "passkey", "credentialId", "cred-" + id,
                        "authenticatorId", "auth-" + id, "passkeyName", "Laptop"));
    }

    private static Map<String, Object> signRequest(String proposalId, String validatorId, KeyPair key) throws Exception {
        Instant signedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        CanonicalPayload payload = new CanonicalPayload(proposalId, TO, "0.25", "0x", signedAt.toEpochMilli());
        Signature ecdsa = Signature.getInstance("SHA256withECDSA");
        ecdsa.initSign(key.getPrivate());
        ecdsa.update(payload.bytes());
        return Map.of(
                "validatorId", validatorId,
                "signature", Base64.getEncoder().encodeToString(ecdsa.sign()),
                "signerType", "passkey",
                "signedAt", signedAt.toString());
    }

    private static KeyPair p256() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        return generator.generateKeyPair();
    }
}
