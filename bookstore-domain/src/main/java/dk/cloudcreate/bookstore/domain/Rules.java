package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.aggregates.command.ValidationFailure;

import java.math.BigDecimal;
import java.util.*;

/**
 * Field validation shared by the bookstore aggregates
 */
public final class Rules {
    private Rules() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static void requiredText(ValidationFailure.Builder validation, String field, String label, String value, int maxLength) {
        if (isBlank(value)) {
            validation.fieldError(field, label + " is required");
        } else if (value.length() > maxLength) {
            validation.fieldError(field, label + " cannot exceed " + maxLength + " characters");
        }
    }

    public static void optionalText(ValidationFailure.Builder validation, String field, String label, String value, int maxLength) {
        validation.fieldErrorIf(value != null && value.length() > maxLength, field, label + " cannot exceed " + maxLength + " characters");
    }

    /**
     * ISBN-10 or ISBN-13. Hyphens and spaces are ignored, a missing ISBN is valid
     */
    public static boolean isValidIsbn(String isbn) {
        if (isBlank(isbn)) {
            return true;
        }
        var digits = isbn.replace("-", "").replace(" ", "");
        return (digits.length() == 10 || digits.length() == 13) && digits.chars().allMatch(Character::isDigit);
    }

    public static boolean isIsoCurrencyCode(String currencyCode) {
        if (currencyCode == null || currencyCode.length() != 3) {
            return false;
        }
        try {
            return Currency.getInstance(currencyCode).getCurrencyCode().equals(currencyCode);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static void prices(ValidationFailure.Builder validation, Map<String, BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            validation.fieldError("prices", "At least one price is required");
            return;
        }
        prices.forEach((currency, amount) -> {
            validation.fieldErrorIf(!isIsoCurrencyCode(currency), "prices", "'" + currency + "' isn't an ISO 4217 currency code");
            validation.fieldErrorIf(amount == null || amount.signum() < 0, "prices", "Price in " + currency + " cannot be negative");
        });
    }
}
