package com.contact.resolution.rules;

/**
 * Normalizes phone numbers to E.164 form.
 *
 * <p>Every non-digit is stripped. Input that started with {@code +} keeps its digits as given;
 * ten digits are treated as a North American number and get {@code +1}; anything else is
 * prefixed with {@code +}. Input without digits yields the empty string, meaning "no phone".
 * Normalizing an already normalized number returns it unchanged.</p>
 */
public final class PhoneNormalizer {

    private PhoneNormalizer() {
        // Utility class
    }

    public static String normalize(String phone) {
        if (phone == null) {
            return "";
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return "";
        }
        if (phone.trim().startsWith("+")) {
            return "+" + digits;
        }
        if (digits.length() == 10) {
            return "+1" + digits;
        }
        return "+" + digits;
    }

    public static boolean isPresent(String phone) {
        return !normalize(phone).isEmpty();
    }

    /**
     * Both numbers present and equal after normalization.
     */
    public static boolean sameNumber(String phone1, String phone2) {
        String normalized1 = normalize(phone1);
        return !normalized1.isEmpty() && normalized1.equals(normalize(phone2));
    }
}
