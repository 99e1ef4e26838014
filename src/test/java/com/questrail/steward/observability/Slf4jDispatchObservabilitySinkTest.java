package com.questrail.steward.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.steward.channel.ChannelError;
import com.questrail.steward.channel.ChannelException;
import com.questrail.steward.channel.ChannelOperation;
import com.questrail.steward.dispatch.DispatchOutcome;
import com.questrail.steward.dispatch.FailureClass;
import com.questrail.steward.dispatch.internal.ack.AckPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slf4jDispatchObservabilitySinkTest
 * -----------------------------------------------------------------------------
 * Level mapping of the production sink. Expected races are warnings, dropped
 * duplicates are informational, faults are errors.
 */
class Slf4jDispatchObservabilitySinkTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private Slf4jDispatchObservabilitySink sink;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        sink = new Slf4jDispatchObservabilitySink();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
    }

    private ILoggingEvent single() {
        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        return events.get(0);
    }

    @Test
    void duplicateIsInfo() {
        sink.onRejected(new DispatchRejectedEvent(T0, "E1", "u1", "join_club_1", DispatchOutcome.DUPLICATE));

        assertEquals(Level.INFO, single().getLevel());
    }

    @Test
    void unroutedIsWarn() {
        sink.onRejected(new DispatchRejectedEvent(T0, "E1", "u1", "old_1", DispatchOutcome.UNROUTED));

        ILoggingEvent logged = single();
        assertEquals(Level.WARN, logged.getLevel());
        assertTrue(logged.getFormattedMessage().contains("old_1"));
    }

    @Test
    void expiredChannelIsWarnButUnknownChannelFailureIsError() {
        ChannelException expired = new ChannelException(ChannelError.EXPIRED, "Unknown interaction");
        sink.onChannelFailure(new ChannelFailureEvent(T0, "E1", ChannelOperation.DEFER_ACK, ChannelError.EXPIRED, expired));
        ChannelException broken = new ChannelException(ChannelError.UNKNOWN, "500");
        sink.onChannelFailure(new ChannelFailureEvent(T0, "E2", ChannelOperation.OPEN_RESPONSE, ChannelError.UNKNOWN, broken));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals(Level.ERROR, appender.list.get(1).getLevel());
        assertNotNull(appender.list.get(1).getThrowableProxy());
    }

    @Test
    void suppressedResponseIsWarn() {
        sink.onResponseSuppressed(new ResponseSuppressedEvent(T0, "E1", ChannelOperation.EDIT_RESPONSE, "unreachable"));

        assertEquals(Level.WARN, single().getLevel());
    }

    @Test
    void unknownFaultCarriesOperatorReviewMarker() {
        sink.onHandlerFault(new HandlerFaultEvent(T0, "E1", "u1", "setup", Duration.ofMillis(12),
            FailureClass.UNKNOWN, new RuntimeException("?")));

        ILoggingEvent logged = single();
        assertEquals(Level.ERROR, logged.getLevel());
        assertNotNull(logged.getMarkerList());
        assertTrue(logged.getMarkerList().contains(Slf4jDispatchObservabilitySink.OPERATOR_REVIEW));
    }

    @Test
    void ordinaryFaultIsErrorWithoutMarker() {
        sink.onHandlerFault(new HandlerFaultEvent(T0, "E1", "u1", "setup", Duration.ofMillis(12),
            FailureClass.HANDLER_FAULT, new IllegalStateException("db")));

        ILoggingEvent logged = single();
        assertEquals(Level.ERROR, logged.getLevel());
        assertTrue(logged.getMarkerList() == null || logged.getMarkerList().isEmpty());
        assertTrue(logged.getFormattedMessage().contains("u1"));
    }

    @Test
    void completionWithNothingVisibleIsWarn() {
        sink.onDispatchCompleted(new DispatchCompletedEvent(T0, "E1", "u1", "quiet_1",
            DispatchOutcome.HANDLED, AckPhase.UNACKED, false, null, Duration.ofMillis(3)));
        sink.onDispatchCompleted(new DispatchCompletedEvent(T0, "E2", "u1", "ok_1",
            DispatchOutcome.HANDLED, AckPhase.RESPONDED, false, null, Duration.ofMillis(3)));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals(Level.DEBUG, appender.list.get(1).getLevel());
    }

    @Test
    void deadlineMissIsWarn() {
        sink.onAckDeadlineMissed(new AckDeadlineMissedEvent(T0, "E1", "report", Duration.ofSeconds(3)));

        assertEquals(Level.WARN, single().getLevel());
    }
}
