package com.contact.resolution.similarity;

import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.rules.DefaultNormalizationRules;
import com.contact.resolution.rules.IdentityField;
import com.contact.resolution.rules.NormalizationEngine;
import com.contact.resolution.rules.PhoneNormalizer;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default keys:
 * <ul>
 *   <li><b>Exact</b>: {@code email:<normalized>} and {@code phone:<e164>}</li>
 *   <li><b>Prefix</b>: first 3 characters of the full name ({@code pfx:jon})</li>
 *   <li><b>Sorted tokens</b>: first two name tokens sorted ({@code tok:jon|smith})</li>
 *   <li><b>Bigram</b>: first 2 characters of the full name ({@code bg:jo})</li>
 *   <li><b>Name token</b>: each token of two or more characters ({@code nt:smith})</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final String EMAIL_PREFIX = "email:";
    public static final String PHONE_PREFIX = "phone:";

    private final NormalizationEngine normalizationEngine;

    public DefaultBlockingKeyStrategy() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public DefaultBlockingKeyStrategy(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = normalizationEngine;
    }

    @Override
    public BlockingKeys generateKeys(IdentityTuple identity) {
        if (identity == null) {
            return BlockingKeys.none();
        }

        Set<String> exact = new LinkedHashSet<>();
        String email = normalizationEngine.normalize(identity.email(), IdentityField.EMAIL);
        if (!email.isEmpty()) {
            exact.add(EMAIL_PREFIX + email);
        }
        String phone = PhoneNormalizer.normalize(identity.phone());
        if (!phone.isEmpty()) {
            exact.add(PHONE_PREFIX + phone);
        }

        return new BlockingKeys(exact, nameKeys(
                normalizationEngine.normalizeFullName(identity.firstName(), identity.lastName())));
    }

    private Set<String> nameKeys(String name) {
        Set<String> keys = new LinkedHashSet<>();
        if (name.isEmpty()) {
            return keys;
        }

        keys.add("pfx:" + (name.length() >= 3 ? name.substring(0, 3) : name));

        String[] tokens = name.split(" ");
        if (tokens.length >= 2) {
            String[] sorted = Arrays.copyOf(tokens, tokens.length);
            Arrays.sort(sorted);
            keys.add("tok:" + sorted[0] + "|" + sorted[1]);
        } else {
            keys.add("tok:" + tokens[0]);
        }

        keys.add("bg:" + (name.length() >= 2 ? name.substring(0, 2) : name));

        for (String token : tokens) {
            if (token.length() >= 2) {
                keys.add("nt:" + token);
            }
        }
        return keys;
    }
}
