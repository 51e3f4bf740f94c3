package com.largomodo.kormarc.validation;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Cataloging rules of one institution, checked by {@link InstitutionPolicyValidator}.
 * <p>
 * Policies are plain properties files (UTF-8):
 * <pre>
 * required.tag=040
 * required.subfields=a,c,d
 * institution.subfield=a
 * institution.211032=Nowon Information Library
 * </pre>
 * Every {@code institution.<code>} key other than {@code institution.subfield} adds a
 * known institution code with its display name.
 *
 * @param requiredTag          data field the institution requires
 * @param requiredSubfields    subfield codes that field must carry, in reporting order
 * @param institutionSubfield  subfield holding the institution code
 * @param knownInstitutions    allow-list of institution codes mapped to names, sorted by code
 */
public record InstitutionPolicy(String requiredTag, List<Character> requiredSubfields,
                                char institutionSubfield, Map<String, String> knownInstitutions) {

    public static final String DEFAULT_RESOURCE = "/policy/institution-policy.properties";

    private static final String KEY_TAG = "required.tag";
    private static final String KEY_SUBFIELDS = "required.subfields";
    private static final String KEY_INSTITUTION_SUBFIELD = "institution.subfield";
    private static final String INSTITUTION_PREFIX = "institution.";
    private static final Pattern DATA_TAG = Pattern.compile("^(0[1-9][0-9]|[1-9][0-9]{2})$");

    public InstitutionPolicy {
        if (requiredTag == null || !DATA_TAG.matcher(requiredTag).matches()) {
            throw new IllegalArgumentException("Policy tag must be a data field tag (010-999), got: " + requiredTag);
        }
        Objects.requireNonNull(requiredSubfields, "requiredSubfields must not be null");
        Objects.requireNonNull(knownInstitutions, "knownInstitutions must not be null");
        requiredSubfields = List.copyOf(requiredSubfields);
        knownInstitutions = Map.copyOf(knownInstitutions);
    }

    public boolean isKnownInstitution(String code) {
        return knownInstitutions.containsKey(code);
    }

    /**
     * @return known institution codes, ascending
     */
    public List<String> institutionCodes() {
        return List.copyOf(new TreeMap<>(knownInstitutions).keySet());
    }

    /**
     * Policy bundled with the application (Nowon district public libraries).
     *
     * @throws UncheckedIOException if the bundled resource is missing or unreadable
     */
    public static InstitutionPolicy defaultPolicy() {
        try (InputStream in = InstitutionPolicy.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Internal resource " + DEFAULT_RESOURCE
                        + " not found. Ensure application is built correctly.");
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Load a policy from a UTF-8 properties file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a required key is missing or malformed
     */
    public static InstitutionPolicy load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    private static InstitutionPolicy load(InputStream in) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    public static InstitutionPolicy fromProperties(Properties properties) {
        String tag = require(properties, KEY_TAG);

        List<Character> subfields = new ArrayList<>();
        for (String code : require(properties, KEY_SUBFIELDS).split(",")) {
            String trimmed = code.strip();
            if (trimmed.length() != 1) {
                throw new IllegalArgumentException(
                        "Invalid subfield code '" + trimmed + "' in " + KEY_SUBFIELDS);
            }
            subfields.add(trimmed.charAt(0));
        }

        String institutionSubfield = require(properties, KEY_INSTITUTION_SUBFIELD);
        if (institutionSubfield.length() != 1) {
            throw new IllegalArgumentException(
                    KEY_INSTITUTION_SUBFIELD + " must be a single character, got: " + institutionSubfield);
        }

        Map<String, String> institutions = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(INSTITUTION_PREFIX) && !key.equals(KEY_INSTITUTION_SUBFIELD)) {
                institutions.put(key.substring(INSTITUTION_PREFIX.length()), properties.getProperty(key).strip());
            }
        }

        return new InstitutionPolicy(tag, subfields, institutionSubfield.charAt(0), institutions);
    }

    private static String require(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing policy property: " + key);
        }
        return value.strip();
    }
}
