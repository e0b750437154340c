package com.disease.normalization.api;

import com.disease.normalization.core.model.SourceName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceFilter Tests")
class SourceFilterTest {

    @Test
    @DisplayName("No parameters selects every source in priority order")
    void allSources() {
        SourceFilter filter = SourceFilter.of(null, "  ");
        assertEquals(List.of(SourceName.values()), List.copyOf(filter.sources()));
    }

    @Test
    @DisplayName("Include list is case-insensitive and trimmed")
    void include() {
        SourceFilter filter = SourceFilter.of(" ncit ,ONCOTREE", null);
        assertEquals(Set.of(SourceName.NCIT, SourceName.ONCOTREE), filter.sources());
        assertTrue(filter.includes(SourceName.NCIT));
        assertFalse(filter.includes(SourceName.DO));
    }

    @Test
    @DisplayName("Exclude list removes the named sources")
    void exclude() {
        SourceFilter filter = SourceFilter.of("", "omim");
        assertEquals(EnumSet.complementOf(EnumSet.of(SourceName.OMIM)), filter.sources());
    }

    @Test
    @DisplayName("Both lists at once are rejected")
    void bothLists() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> SourceFilter.of("NCIt", "DO"));
        assertEquals("Cannot request both source inclusions and exclusions.", e.getMessage());
    }

    @Test
    @DisplayName("Unknown names are listed in the error")
    void unknownNames() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> SourceFilter.of(null, "DO,HPO,Orphanet"));
        assertEquals("Invalid source name(s): [HPO, Orphanet]", e.getMessage());
    }

    @Test
    @DisplayName("Null source is never included")
    void nullSource() {
        assertFalse(SourceFilter.all().includes(null));
    }
}
