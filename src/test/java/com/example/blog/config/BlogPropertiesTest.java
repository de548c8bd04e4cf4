package com.example.blog.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlogPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void initValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsAreValidOnceSecretIsSet() {
        BlogProperties props = new BlogProperties();
        props.setSecretKey("s3cret");

        assertTrue(validator.validate(props).isEmpty());
    }

    @Test
    void missingSecretKeyIsRejected() {
        Set<ConstraintViolation<BlogProperties>> violations = validator.validate(new BlogProperties());

        assertEquals(1, violations.size());
        assertEquals("secretKey", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void sessionTtlBeyondCookieMaxAgeIsRejected() {
        BlogProperties props = new BlogProperties();
        props.setSecretKey("s3cret");
        props.getSession().setTtl(Duration.ofSeconds(Integer.MAX_VALUE + 1L));

        Set<ConstraintViolation<BlogProperties>> violations = validator.validate(props);

        assertEquals(1, violations.size());
        assertEquals("session.ttl", violations.iterator().next().getPropertyPath().toString());
    }
}
