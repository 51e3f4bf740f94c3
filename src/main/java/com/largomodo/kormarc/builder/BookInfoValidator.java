package com.largomodo.kormarc.builder;

import com.largomodo.kormarc.util.IsbnUtil;
import com.largomodo.kormarc.validation.ValidationError;
import com.largomodo.kormarc.validation.ValidationResult;
import com.largomodo.kormarc.validation.ValidationWarning;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks {@link BookInfo} before a record is built from it.
 * <p>
 * Reported as tier 0 so the result can sit next to the record tiers in one report.
 * Findings refer to the tag the value will be written to.
 */
public class BookInfoValidator {

    public static final int TIER = 0;
    public static final int MIN_YEAR = 1900;
    public static final int FUTURE_YEARS = 5;

    private static final Pattern KDC = Pattern.compile("^[0-9]\\d{0,2}$");
    private static final Pattern PUB_YEAR = Pattern.compile("^(\\d{4})(\\d{2})?$");

    private final Clock clock;

    public BookInfoValidator() {
        this(Clock.systemDefaultZone());
    }

    public BookInfoValidator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ValidationResult validate(BookInfo info) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        checkIsbn(info.isbn(), errors);

        if (info.title().isBlank()) {
            errors.add(ValidationError.error("245", "Title must not be blank", "Provide the title proper"));
        }

        checkKdc(info.kdc(), errors, warnings);
        checkPublicationYear(info.pubYear(), errors);

        if (info.pages() != null && info.pages() < 1) {
            errors.add(ValidationError.error("300", "Page count must be at least 1, got: " + info.pages(), null));
        }
        if (info.price() != null && info.price() < 0) {
            errors.add(ValidationError.error(null, "Price must not be negative, got: " + info.price(), null));
        }
        if (info.publisher() == null || info.publisher().isBlank()) {
            warnings.add(new ValidationWarning("260", "Publisher is missing", "Add the publisher name"));
        }

        return ValidationResult.of(TIER, "BookInfoValidator", errors, warnings);
    }

    private static void checkIsbn(String isbn, List<ValidationError> errors) {
        String normalized = IsbnUtil.normalize(isbn);
        switch (normalized.length()) {
            case 10 -> {
                if (!IsbnUtil.isValidIsbn10(normalized)) {
                    errors.add(ValidationError.error("020", "Invalid ISBN-10: " + isbn,
                            "Check the digits and the check character"));
                }
            }
            case 13 -> {
                if (!IsbnUtil.isValidIsbn13(normalized)) {
                    errors.add(ValidationError.error("020", "Invalid ISBN-13: " + isbn,
                            "Check the digits and the check digit"));
                }
            }
            default -> errors.add(ValidationError.error("020",
                    "ISBN must have 10 or 13 characters, got " + normalized.length(),
                    "Hyphens and spaces are ignored"));
        }
    }

    private static void checkKdc(String kdc, List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (kdc == null || kdc.isEmpty()) {
            warnings.add(new ValidationWarning("082", "KDC classification is missing", "Add a KDC number"));
            return;
        }
        if (!KDC.matcher(kdc).matches()) {
            errors.add(ValidationError.error("082", "Invalid KDC classification: " + kdc,
                    "Use one to three digits starting with 0-9"));
            return;
        }
        if (KdcMainClass.fromKdc(kdc).isEmpty()) {
            warnings.add(new ValidationWarning("082", "Unknown KDC main class: " + kdc.charAt(0), null));
        }
    }

    private void checkPublicationYear(String pubYear, List<ValidationError> errors) {
        if (pubYear == null) {
            return;
        }
        Matcher m = PUB_YEAR.matcher(pubYear);
        if (!m.matches()) {
            errors.add(ValidationError.error("260", "Invalid publication year: " + pubYear,
                    "Use YYYY or YYYYMM"));
            return;
        }
        int year = Integer.parseInt(m.group(1));
        int maxYear = LocalDate.now(clock).getYear() + FUTURE_YEARS;
        if (year < MIN_YEAR || year > maxYear) {
            errors.add(ValidationError.error("260",
                    "Publication year " + year + " is outside " + MIN_YEAR + "-" + maxYear, null));
        }
    }
}
