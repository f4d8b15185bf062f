package com.workqueue.registry;

import com.google.gson.JsonElement;
import com.workqueue.core.JobExecutionException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentDecoderTest {

    @Test
    public void testEncodeListKeepsOrderAndTypes() {
        assertEquals("[12,\"x\",true,null]", ArgumentDecoder.encodeList(Arrays.asList(12, "x", true, null)));
        assertEquals("[]", ArgumentDecoder.encodeList(List.of()));
        assertEquals("[\"<b>\"]", ArgumentDecoder.encodeList(List.of("<b>")));
    }

    @Test
    public void testEncodeListWritesSubjectSetsAsIds() {
        SubjectSet partners = new SubjectSet("Partner", List.of(3L, 4L));
        assertEquals("[[3,4],\"x\"]", ArgumentDecoder.encodeList(List.of(partners, "x")));
    }

    @Test
    public void testDecodeSubjectIds() {
        assertEquals(List.of(1L, 2L, 3L), ArgumentDecoder.decodeSubjectIds("[1, 2, 3]"));
        assertEquals(List.of(), ArgumentDecoder.decodeSubjectIds("[]"));
        assertEquals(List.of(7L), ArgumentDecoder.decodeSubjectIds("[7.0]"));
    }

    @Test
    public void testDecodeSubjectIdsRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds("[no_ids]"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds("[1, 2"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds("{\"id\": 1}"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds("[1] [2]"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds(""));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds(null));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArgumentDecoder.decodeSubjectIds("[1, \"two\"]"));
        assertTrue(e.getMessage().contains("element 1"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeSubjectIds("[1.5]"));
    }

    @Test
    public void testDecodeArgumentListRejectsUnquotedWords() {
        assertEquals(3, ArgumentDecoder.decodeArgumentList("[[1, 2], \"My string value\", true]").size());
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeArgumentList("[oops]"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentDecoder.decodeArgumentList("\"not a list\""));
    }

    @Test
    public void testScalarArguments() {
        List<JsonElement> raw = ArgumentDecoder.decodeArgumentList("[12, \"x\", true, 2.5, null, [1, \"a\"]]");

        assertEquals(12L, ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(0), "Partner"));
        assertEquals("x", ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(1), "Partner"));
        assertEquals(Boolean.TRUE, ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(2), "Partner"));
        assertEquals(2.5, ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(3), "Partner"));
        assertNull(ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(4), "Partner"));
        assertEquals(List.of(1L, "a"), ArgumentDecoder.decodeArgument(ParamKind.SCALAR, raw.get(5), "Partner"));
    }

    @Test
    public void testSubjectArgumentsAcceptOneIdOrAList() {
        List<JsonElement> raw = ArgumentDecoder.decodeArgumentList("[5, [6, 7], \"eight\"]");

        assertEquals(new SubjectSet("Partner", List.of(5L)),
                ArgumentDecoder.decodeArgument(ParamKind.SUBJECTS, raw.get(0), "Partner"));
        assertEquals(new SubjectSet("Partner", List.of(6L, 7L)),
                ArgumentDecoder.decodeArgument(ParamKind.SUBJECTS, raw.get(1), "Partner"));
        assertThrows(JobExecutionException.class,
                () -> ArgumentDecoder.decodeArgument(ParamKind.SUBJECTS, raw.get(2), "Partner"));
    }

    @Test
    public void testStructuredArgumentsMustBeObjects() {
        List<JsonElement> raw = ArgumentDecoder.decodeArgumentList("[{\"name\": \"Acme\", \"tags\": [1]}, 3]");

        Object decoded = ArgumentDecoder.decodeArgument(ParamKind.STRUCTURED, raw.get(0), "Partner");
        assertEquals(Map.of("name", "Acme", "tags", List.of(1L)), decoded);
        assertThrows(UnsupportedOperationException.class, () -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) decoded;
            map.put("other", 1);
        });
        assertThrows(JobExecutionException.class,
                () -> ArgumentDecoder.decodeArgument(ParamKind.STRUCTURED, raw.get(1), "Partner"));
    }
}
