package com.workqueue.registry;

import com.workqueue.core.TargetRef;
import com.workqueue.core.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TargetValidatorTest {

    private TargetValidator validator;

    @BeforeEach
    public void setUp() {
        OperationRegistry registry = new OperationRegistry();
        registry.domain("Partner")
                .operation("NameGet", (context, subjects, args) -> "names")
                .operation("Write", (context, subjects, args) -> null,
                        ParamKind.STRUCTURED)
                .operation("Merge", (context, subjects, args) -> null,
                        ParamKind.SUBJECTS, ParamKind.SCALAR, ParamKind.SCALAR);
        validator = new TargetValidator(registry);
    }

    @Test
    public void testValidTargetResolvesOperation() {
        OperationDefinition operation = validator.validate(
                new TargetRef("Partner", "Merge", "[1, 2]", "[[3], \"x\", true]"));
        assertEquals(3, operation.getArity());
        assertEquals(0, validator.validate(TargetRef.of("Partner", "NameGet")).getArity());
    }

    @Test
    public void testUnknownDomain() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(TargetRef.of("Nope", "NameGet")));
        assertEquals("Unknown domain: Nope", e.getMessage());
    }

    @Test
    public void testUnknownOperation() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(TargetRef.of("Partner", "Explode")));
        assertEquals("Unknown operation in domain Partner: Explode", e.getMessage());
    }

    @Test
    public void testMalformedSubjectIdsAndArgumentsHaveDistinctMessages() {
        ValidationException badIds = assertThrows(ValidationException.class,
                () -> validator.validate(new TargetRef("Partner", "NameGet", "[no_ids]", "[]")));
        ValidationException badArgs = assertThrows(ValidationException.class,
                () -> validator.validate(new TargetRef("Partner", "Write", "[1]", "[no_args]")));

        assertTrue(badIds.getMessage().startsWith("unable to decode SubjectIDs: "), badIds.getMessage());
        assertTrue(badArgs.getMessage().startsWith("unable to decode Arguments: "), badArgs.getMessage());
    }

    @Test
    public void testSubjectIdsAreCheckedBeforeArguments() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new TargetRef("Partner", "Write", "[x]", "[y]")));
        assertTrue(e.getMessage().startsWith("unable to decode SubjectIDs"));
    }

    @Test
    public void testArgumentsAreDecodedBeforeOperationLookup() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new TargetRef("Partner", "Explode", "[]", "[y]")));
        assertTrue(e.getMessage().startsWith("unable to decode Arguments"));
    }

    @Test
    public void testArityMismatch() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new TargetRef("Partner", "Merge", "[1]", "[[3], \"x\"]")));
        assertEquals("wrong number of arguments given: expected 3 arguments, received 2", e.getMessage());
    }

    @Test
    public void testMissingTarget() {
        assertThrows(ValidationException.class, () -> validator.validate(null));
    }
}
