package com.ryuqq.fleetflow.core.spi;

import com.ryuqq.fleetflow.core.model.MessageId;

/**
 * Invoked once when a registered deadline passes without acknowledgement.
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExpiryCallback {

    void onExpired(MessageId messageId);
}
