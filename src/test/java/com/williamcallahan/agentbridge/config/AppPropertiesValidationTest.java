package com.williamcallahan.agentbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Verifies the bean-validation constraints on bound application properties.
 */
class AppPropertiesValidationTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void defaultsAreValid() {
        assertTrue(validator.validate(new AppProperties()).isEmpty());
    }

    @Test
    void rejectsBlankSocketBaseUrl() {
        AppProperties appProperties = new AppProperties();
        appProperties.getUpstream().setSocketBaseUrl(" ");

        Set<ConstraintViolation<AppProperties>> violations = validator.validate(appProperties);

        assertEquals(1, violations.size());
        assertEquals("upstream.socketBaseUrl", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void rejectsEmptyModelListAndNonPositiveCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getModels().setAvailable(List.of());
        appProperties.getConversations().setMaxEntries(0);

        assertEquals(2, validator.validate(appProperties).size());
    }
}
