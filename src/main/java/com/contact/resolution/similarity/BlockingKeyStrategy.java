package com.contact.resolution.similarity;

import com.contact.resolution.core.model.IdentityTuple;

/**
 * Derives blocking keys from an identity tuple.
 *
 * <p>The store indexes every contact under its keys and duplicate discovery only scores
 * contacts sharing at least one key with the searched tuple, so the whole contact
 * population is never loaded. Keys must be coarse enough that any pair the scorer would
 * flag shares one: every exact email or phone match shares an exact key, and fuzzy keys
 * should cover names one or two edits apart.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * @return the keys for the tuple (never null, may be empty)
     */
    BlockingKeys generateKeys(IdentityTuple identity);
}
