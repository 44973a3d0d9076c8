package com.eia.api.cli.commands;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.eia.api.cli.EiaCliMain;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.query.FacetEncoder;
import com.eia.api.query.FacetSet;
import com.eia.api.query.Frequency;

import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

public class FetchCommandTest {

    @Test
    public void testRepeatedFacetBecomesMultiValue() {
        FacetSet facets = FetchCommand.parseFacets(Arrays.asList("parent=CISO", "subba=SDGE", "subba=PGAE"));

        assertEquals("facets[parent][]=CISO&facets[subba][]=SDGE&facets[subba][]=PGAE", FacetEncoder.encode(facets));
    }

    @Test
    public void testMalformedFacetIsRejected() {
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseFacets(List.of("parent")));
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseFacets(List.of("=CISO")));
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseFacets(List.of("parent=")));
        assertTrue(FetchCommand.parseFacets(null).isEmpty());
    }

    @Test
    public void testBoundParsing() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), FetchCommand.parseBound("2024-01-01", Frequency.DAILY));
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), FetchCommand.parseBound("2024-01-01", Frequency.HOURLY));
        assertEquals(LocalDateTime.of(2024, 1, 1, 17, 0), FetchCommand.parseBound("2024-01-01T17", Frequency.HOURLY));
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseBound("2024-01-01T17", Frequency.DAILY));
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseBound("01/01/2024", Frequency.DAILY));
        assertThrows(InvalidArgumentException.class, () -> FetchCommand.parseBound(" ", Frequency.HOURLY));
    }

    @Test
    public void testCommandLineOptionsParse() {
        CommandLine cmd = EiaCliMain.createCommandLine();

        ParseResult result = cmd.parseArgs("--format", "CSV", "fetch", "electricity/rto/region-sub-ba-data/data/",
                "--facet", "parent=CISO", "--start", "2024-01-01T00", "--end", "2024-01-31T23",
                "--max-rows", "2000", "--concurrency", "4");

        EiaCliMain root = cmd.getCommand();
        assertEquals(EiaCliMain.OutputFormat.CSV, root.getFormat());
        assertTrue(result.hasSubcommand());
        ParseResult fetch = result.subcommand();
        assertEquals("fetch", fetch.commandSpec().name());
        Integer maxRows = fetch.matchedOptionValue("--max-rows", null);
        List<String> facets = fetch.matchedOptionValue("--facet", null);
        assertEquals(2000, maxRows.intValue());
        assertEquals(List.of("parent=CISO"), facets);
        assertFalse(fetch.hasMatchedOption("--unbounded"));
    }

    @Test
    public void testMissingPathFailsWithUsageExitCode() {
        int exitCode = EiaCliMain.createCommandLine().execute("fetch", "--start", "2024-01-01");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
    }

    @Test
    public void testUnboundedFetchAcceptsOneSidedRange() {
        ParseResult result = EiaCliMain.createCommandLine().parseArgs("fetch", "electricity/rto/region-data/data/",
                "--unbounded", "--start", "2024-01-01", "--frequency", "daily");

        ParseResult fetch = result.subcommand();
        assertTrue(fetch.hasMatchedOption("--unbounded"));
        assertTrue(fetch.hasMatchedOption("--start"));
        assertFalse(fetch.hasMatchedOption("--end"));
    }

    @Test
    public void testChunkedFetchNeedsBothBounds() {
        int exitCode = EiaCliMain.createCommandLine().execute("--apiKey", "test-key",
                "fetch", "electricity/rto/region-data/data/", "--start", "2024-01-01", "--frequency", "daily");

        assertEquals(1, exitCode);
    }
}
