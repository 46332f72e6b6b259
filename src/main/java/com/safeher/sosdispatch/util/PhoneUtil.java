package com.safeher.sosdispatch.util;

/**
 * Normalizes user-entered phone numbers to E.164 (+&lt;country&gt;&lt;number&gt;) before they
 * reach the SMS/voice gateway.
 *
 * Rules, applied in order:
 *  - spaces, dashes, dots and parentheses are removed
 *  - a leading "00" international prefix becomes "+"
 *  - numbers already starting with "+" are kept as-is
 *  - a single trunk "0" is dropped and the default country code applied
 *  - a bare national number gets the default country code
 *  - a number that already starts with the country code digits just gets "+"
 */
public class PhoneUtil {

    private PhoneUtil() {
    }

    public static String normalize(String raw, String defaultCountryCode) {
        if (raw == null) return null;
        String cleaned = raw.replaceAll("[\\s\\-().]", "");
        if (cleaned.isEmpty()) return cleaned;

        if (cleaned.startsWith("00")) {
            return "+" + cleaned.substring(2);
        }
        if (cleaned.startsWith("+")) {
            return cleaned;
        }

        String countryCode = defaultCountryCode == null || defaultCountryCode.isBlank()
                ? "+91"
                : (defaultCountryCode.startsWith("+") ? defaultCountryCode : "+" + defaultCountryCode);
        String countryDigits = countryCode.substring(1);

        if (cleaned.startsWith("0")) {
            return countryCode + cleaned.substring(1);
        }
        if (cleaned.length() > 10 && cleaned.startsWith(countryDigits)) {
            return "+" + cleaned;
        }
        return countryCode + cleaned;
    }
}
