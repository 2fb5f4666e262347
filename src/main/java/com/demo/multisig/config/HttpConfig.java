package com.demo.multisig.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/** Outbound HTTP to the push / email / SMS gateways. */
@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(@Value("${notifications.http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${notifications.http.read-timeout-ms:8000}") int readTimeoutMs) {
        CloseableHttpClient client = HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(client);
        f.setConnectTimeout(connectTimeoutMs);
        return new RestTemplate(f);
    }
}
