package com.questrail.steward.runtime;

import com.questrail.steward.channel.ChannelOperation;
import com.questrail.steward.channel.RecordingResponseChannel;
import com.questrail.steward.config.StewardRuntimeConfig;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.observability.Slf4jDispatchObservabilitySink;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StewardRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() throws Exception {
        RecordingResponseChannel channel = new RecordingResponseChannel();
        CountDownLatch answered = new CountDownLatch(2);

        StewardRuntime runtime = StewardRuntime.builder()
            .withConfig(StewardRuntimeConfig.builder()
                .withBindAddress(new InetSocketAddress("127.0.0.1", 0)) // ephemeral
                .withHandlerThreads(2)
                .build())
            .withResponseChannel(channel)
            .withObservabilitySink(new Slf4jDispatchObservabilitySink())
            .withHandlers(registry -> registry.command("ping").handle((event, responder) -> {
                responder.respond(event, "pong");
                answered.countDown();
            }))
            .build();

        runtime.start();
        try {
            assertTrue(runtime.isIngressUp());
            assertTrue(runtime.router().registry().isSealed());

            HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            HttpRequest request = HttpRequest.newBuilder(
                    URI.create("http://127.0.0.1:" + runtime.localAddress().getPort() + "/events"))
                .timeout(Duration.ofSeconds(5))
                .POST(HttpRequest.BodyPublishers.ofString(
                    "{\"id\":\"E1\",\"type\":\"command\",\"actorId\":\"u1\",\"discriminator\":\"ping\"}"))
                .build();
            assertEquals(202, client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());

            assertTrue(runtime.submitEvent(InboundEvent.command("E2", "u1", "ping", Instant.now())));

            assertTrue(answered.await(2, TimeUnit.SECONDS));
            assertEquals(2, channel.count(ChannelOperation.OPEN_RESPONSE));
        } finally {
            runtime.stop();
        }

        assertFalse(runtime.submitEvent(InboundEvent.command("E3", "u1", "ping", Instant.now())));
    }
}
