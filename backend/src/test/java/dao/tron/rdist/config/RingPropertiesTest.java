package dao.tron.rdist.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RingPropertiesTest {

    private static Validator validator;

    @BeforeAll
    static void initValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private static Set<String> invalidFields(RingProperties props) {
        return validator.validate(props).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Ring shape has no defaults and is rejected while unset")
    void testShapeRequired() {
        RingProperties props = new RingProperties();

        assertNull(props.getSlots());
        assertNull(props.getMaxClaims());
        assertEquals(Set.of("slots", "maxClaims"), invalidFields(props));
    }

    @Test
    @DisplayName("Configured ring shape passes validation")
    void testConfiguredShape() {
        RingProperties props = new RingProperties();
        props.setSlots(10);
        props.setMaxClaims(8192);

        assertTrue(invalidFields(props).isEmpty());
    }

    @Test
    @DisplayName("max-claims must be a power of two")
    void testMaxClaimsPowerOfTwo() {
        RingProperties props = new RingProperties();
        props.setSlots(10);
        props.setMaxClaims(1000);

        assertEquals(Set.of("maxClaimsPowerOfTwo"), invalidFields(props));
    }
}
