package com.largomodo.kormarc.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class InstitutionPolicyTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultPolicy() {
        InstitutionPolicy policy = InstitutionPolicy.defaultPolicy();

        assertEquals("040", policy.requiredTag());
        assertEquals(List.of('a', 'c', 'd'), policy.requiredSubfields());
        assertEquals('a', policy.institutionSubfield());
        assertEquals(List.of("211032", "211033", "211034"), policy.institutionCodes());
        assertEquals("노원정보도서관", policy.knownInstitutions().get("211032"));
        assertTrue(policy.isKnownInstitution("211033"));
        assertFalse(policy.isKnownInstitution("211060"));
    }

    @Test
    void testLoadFromUtf8File() throws IOException {
        Path file = tempDir.resolve("policy.properties");
        Files.writeString(file, String.join("\n",
                "required.tag=040",
                "required.subfields= a , d ",
                "institution.subfield=a",
                "institution.011001=국립중앙도서관",
                ""), StandardCharsets.UTF_8);

        InstitutionPolicy policy = InstitutionPolicy.load(file);

        assertEquals(List.of('a', 'd'), policy.requiredSubfields());
        assertEquals(Map.of("011001", "국립중앙도서관"), policy.knownInstitutions());
    }

    @Test
    void testMissingKey() {
        Properties properties = new Properties();
        properties.setProperty("required.tag", "040");
        properties.setProperty("institution.subfield", "a");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> InstitutionPolicy.fromProperties(properties));
        assertTrue(e.getMessage().contains("required.subfields"));
    }

    @Test
    void testMalformedValues() {
        Properties badSubfield = new Properties();
        badSubfield.setProperty("required.tag", "040");
        badSubfield.setProperty("required.subfields", "a,cd");
        badSubfield.setProperty("institution.subfield", "a");
        assertThrows(IllegalArgumentException.class, () -> InstitutionPolicy.fromProperties(badSubfield));

        Properties controlTag = new Properties();
        controlTag.setProperty("required.tag", "001");
        controlTag.setProperty("required.subfields", "a");
        controlTag.setProperty("institution.subfield", "a");
        assertThrows(IllegalArgumentException.class, () -> InstitutionPolicy.fromProperties(controlTag));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> InstitutionPolicy.load(tempDir.resolve("absent.properties")));
    }
}
