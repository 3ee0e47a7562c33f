package com.ryuqq.wsclient.testkit.contract;

import com.ryuqq.wsclient.core.exception.SignatureVerificationException;
import com.ryuqq.wsclient.core.spi.SignatureVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SignatureVerifier that records every verified body.
 *
 * <p>Accepts everything by default. {@link #rejectAll(String)} makes it throw
 * {@link SignatureVerificationException} for every subsequent body.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingSignatureVerifier implements SignatureVerifier {

    private final List<String> verifiedBodies = new CopyOnWriteArrayList<>();
    private volatile String rejection;

    /**
     * {@inheritDoc}
     */
    @Override
    public void verify(String responseBody) {
        verifiedBodies.add(responseBody);
        String reason = rejection;
        if (reason != null) {
            throw new SignatureVerificationException(reason);
        }
    }

    public void rejectAll(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        this.rejection = reason;
    }

    public void acceptAll() {
        this.rejection = null;
    }

    public List<String> verifiedBodies() {
        return new ArrayList<>(verifiedBodies);
    }

    public int verificationCount() {
        return verifiedBodies.size();
    }
}
