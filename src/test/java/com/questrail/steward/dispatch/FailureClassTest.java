package com.questrail.steward.dispatch;

import com.questrail.steward.channel.ChannelError;
import com.questrail.steward.channel.ChannelException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassTest {

    @Test
    void channelErrorsMapByTag() {
        assertEquals(FailureClass.EXPIRED_CHANNEL, FailureClass.of(ChannelError.EXPIRED));
        assertEquals(FailureClass.ALREADY_ACKNOWLEDGED, FailureClass.of(ChannelError.ALREADY_ACKED));
        assertEquals(FailureClass.PERMISSION_DENIED, FailureClass.of(ChannelError.PERMISSION_DENIED));
        assertEquals(FailureClass.UNKNOWN, FailureClass.of(ChannelError.UNKNOWN));
    }

    @Test
    void classifyInspectsExceptionType() {
        assertEquals(FailureClass.EXPIRED_CHANNEL,
            FailureClass.classify(new ChannelException(ChannelError.EXPIRED, "10062")));
        assertEquals(FailureClass.PERMISSION_DENIED,
            FailureClass.classify(new PermissionDeniedException("no")));
        assertEquals(FailureClass.HANDLER_FAULT,
            FailureClass.classify(new NullPointerException()));
        assertEquals(FailureClass.UNKNOWN,
            FailureClass.classify(new OutOfMemoryError("metaspace")));
    }

    @Test
    void onlyUnknownNeedsOperatorReview() {
        for (FailureClass failureClass : FailureClass.values()) {
            assertEquals(failureClass == FailureClass.UNKNOWN, failureClass.requiresOperatorReview(),
                failureClass.name());
        }
    }
}
