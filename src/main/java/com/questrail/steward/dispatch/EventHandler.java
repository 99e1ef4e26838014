package com.questrail.steward.dispatch;

import com.questrail.steward.model.InboundEvent;

/**
 * Business logic bound to a discriminator.
 *
 * <p>Invoked at most once per event id while the id is remembered by the
 * deduplication registry. Handlers answer only through the supplied
 * {@link SafeResponder}. Any exception is caught by the router and turned into
 * a generic failure response.</p>
 */
@FunctionalInterface
public interface EventHandler
{
    void handle(InboundEvent event, SafeResponder responder) throws Exception;
}
