package com.eia.api.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.eia.api.exceptions.InvalidArgumentException;

public class FacetEncoderTest {

    @Test
    public void testSingleAndMultipleValuesInInsertionOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("parent", "CISO");
        raw.put("subba", Arrays.asList("SDGE", "X"));

        String fragment = FacetEncoder.encode(FacetSet.fromMap(raw));

        assertEquals("facets[parent][]=CISO&facets[subba][]=SDGE&facets[subba][]=X", fragment);
    }

    @Test
    public void testEmptyFacetSetEncodesToEmptyString() {
        assertEquals("", FacetEncoder.encode(FacetSet.empty()));
        assertEquals("", FacetEncoder.encode(null));
        assertEquals("", FacetEncoder.encode(FacetSet.fromMap(null)));
    }

    @Test
    public void testValuesArePercentEncoded() {
        FacetSet facets = FacetSet.builder().facet("respondent", "A&B C").build();

        assertEquals("facets[respondent][]=A%26B+C", FacetEncoder.encode(facets));
    }

    @Test
    public void testBuilderVarargsProducesMultipleValue() {
        FacetSet facets = FacetSet.builder()
                .facet("parent", "CISO")
                .facet("subba", "PGAE", "SCE", "SDGE")
                .build();

        assertEquals(2, facets.size());
        assertTrue(facets.asMap().get("parent") instanceof FacetValue.Single);
        assertEquals(List.of("PGAE", "SCE", "SDGE"), facets.asMap().get("subba").values());
        assertEquals("facets[parent][]=CISO&facets[subba][]=PGAE&facets[subba][]=SCE&facets[subba][]=SDGE",
                FacetEncoder.encode(facets));
    }

    @Test
    public void testNonStringFacetValueIsRejected() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("parent", 42);

        assertThrows(InvalidArgumentException.class, () -> FacetSet.fromMap(raw));
    }

    @Test
    public void testListWithNonStringElementIsRejected() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("subba", Arrays.asList("SDGE", 7));

        assertThrows(InvalidArgumentException.class, () -> FacetSet.fromMap(raw));
    }

    @Test
    public void testNullFacetValueIsRejected() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("parent", null);

        assertThrows(InvalidArgumentException.class, () -> FacetSet.fromMap(raw));
        assertThrows(InvalidArgumentException.class, () -> FacetValue.multiple(Arrays.asList("a", null)));
    }

    @Test
    public void testBlankFacetNameIsRejected() {
        assertThrows(InvalidArgumentException.class, () -> FacetSet.builder().facet(" ", "CISO"));
    }
}
