package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulcorpus.model.ExtractionResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class CodeLabelExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CodeLabelExtractor extractor = new CodeLabelExtractor();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void extract_shouldReadBeforeAndAfterFromObjectSlots() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"function_before\": {\"function\": \"int f(){}\", \"target\": 1},"
                        + " \"function_after\": {\"function\": \"int f(){return 0;}\"}}"));

        Assertions.assertEquals("int f(){}", result.beforeCode());
        Assertions.assertEquals(1, result.label());
        Assertions.assertEquals("int f(){return 0;}", result.afterCode());
    }

    @Test
    void extract_shouldFallBackToParentTargetWhenDetailHasNoLabel() throws Exception {
        JsonNode detail = json("{\"code_before\": \"void g(){}\"}");
        JsonNode parent = json("{\"target\": \"true\", \"details\": []}");

        ExtractionResult result = extractor.extract(detail, parent);

        Assertions.assertEquals("void g(){}", result.beforeCode());
        Assertions.assertEquals(1, result.label());
    }

    @Test
    void extract_shouldPreferDetailTargetOverParentTarget() throws Exception {
        JsonNode detail = json("{\"code_before\": \"void g(){}\", \"target\": \"FALSE\"}");
        JsonNode parent = json("{\"target\": 1}");

        Assertions.assertEquals(0, extractor.extract(detail, parent).label());
    }

    @Test
    void extract_shouldUseFirstElementOfListSlot() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"function_before\": [{\"code_before\": \"a();\", \"target\": 0}, {\"function\": \"b();\", \"target\": 1}]}"));

        Assertions.assertEquals("a();", result.beforeCode());
        Assertions.assertEquals(0, result.label());
    }

    @Test
    void extract_shouldTreatStringSlotAsCodeWithoutLabel() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"function_before\": \"  x = 1;\\r\\n\", \"target\": false}"));

        Assertions.assertEquals("x = 1;", result.beforeCode());
        Assertions.assertEquals(0, result.label(), "label falls back to detail.target");
    }

    @Test
    void extract_shouldCascadeWhenObjectSlotHasOnlyBlankCode() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"function_before\": {\"function\": \"   \", \"target\": 1}, \"code\": \"fallback();\"}"));

        Assertions.assertEquals("fallback();", result.beforeCode());
        Assertions.assertEquals(1, result.label());
    }

    @Test
    void extract_shouldUsePatchThenBeforeCodeForAfterCode() throws Exception {
        ExtractionResult withPatch = extractor.extract(json(
                "{\"code\": \"v();\", \"target\": 1, \"patch\": \"@@ -1 +1 @@\"}"));
        ExtractionResult withoutAfter = extractor.extract(json(
                "{\"code\": \"v();\", \"target\": 1}"));

        Assertions.assertEquals("@@ -1 +1 @@", withPatch.afterCode());
        Assertions.assertEquals("v();", withoutAfter.afterCode());
    }

    @Test
    void extract_shouldReportMissingCodeAndLabel() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"function_before\": {\"function\": \"\"}, \"code_before\": \"\", \"target\": 7}"));

        Assertions.assertFalse(result.hasCode());
        Assertions.assertFalse(result.hasLabel());
        Assertions.assertEquals("", result.afterCode());
    }

    @Test
    void extract_shouldStripNullBytes() throws Exception {
        ExtractionResult result = extractor.extract(json(
                "{\"code\": \"a\\u0000b\", \"target\": \"1\"}"));

        Assertions.assertEquals("ab", result.beforeCode());
    }

    @Test
    void chains_shouldDeclarePrecedenceInOrder() {
        Assertions.assertEquals(List.of("function_before", "detail.code_before", "detail.code"),
                extractor.beforeCodeChain().ruleNames());
        Assertions.assertEquals(List.of("function_before.target", "detail.target", "parent.target"),
                extractor.labelChain().ruleNames());
        Assertions.assertEquals(List.of("function_after", "detail.patch", "before_code"),
                extractor.afterCodeChain().ruleNames());
    }

    @Test
    void extract_shouldRejectNonObjectDetail() throws Exception {
        JsonNode detail = json("\"just a string\"");

        Assertions.assertThrows(IllegalArgumentException.class, () -> extractor.extract(detail));
    }
}
