package com.jsprinter.sourcemap;

import com.jsprinter.ast.Loc;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkBuilderTest {

    @Test
    void tracksGeneratedLineAndColumnAcrossAppends() {
        String source = "abc\n    x";
        StringBuilder output = new StringBuilder();
        ChunkBuilder builder = new ChunkBuilder(source);

        builder.addSourceMapping(new Loc(0), output);
        output.append("const a");
        builder.addNilSourceMapping(output);
        output.append(" = 1;\n  ");
        builder.addSourceMapping(new Loc(8), output);
        output.append("x");

        List<Mapping> mappings = builder.generateChunk(output).mappings();
        assertEquals(3, mappings.size());

        assertEquals(new Mapping(0, 0, 0, 0, 0), mappings.get(0));
        assertEquals(Mapping.synthetic(0, 7), mappings.get(1));
        // Offset 8 is line 1, column 4 of the source
        assertEquals(new Mapping(1, 2, 8, 1, 4), mappings.get(2));
    }

    @Test
    void offsetZeroIsARealPosition() {
        ChunkBuilder builder = new ChunkBuilder("<div>");
        StringBuilder output = new StringBuilder();
        builder.addSourceMapping(new Loc(0), output);
        output.append("x");
        builder.addNilSourceMapping(output);

        List<Mapping> mappings = builder.generateChunk(output).mappings();
        assertTrue(mappings.get(0).hasOrigin());
        assertEquals(0, mappings.get(0).originalOffset());
        assertFalse(mappings.get(1).hasOrigin());
    }

    @Test
    void nullLocationRecordsSyntheticMapping() {
        ChunkBuilder builder = new ChunkBuilder("");
        StringBuilder output = new StringBuilder("abc");
        builder.addSourceMapping(null, output);

        Mapping mapping = builder.generateChunk(output).mappings().get(0);
        assertFalse(mapping.hasOrigin());
        assertEquals(3, mapping.generatedColumn());
    }

    @Test
    void chunkIsUnaffectedByLaterMappings() {
        ChunkBuilder builder = new ChunkBuilder("source");
        StringBuilder output = new StringBuilder();
        builder.addSourceMapping(new Loc(1), output);
        Chunk chunk = builder.generateChunk(output);

        output.append("more");
        builder.addSourceMapping(new Loc(2), output);

        assertEquals(1, chunk.mappings().size());
        assertEquals(2, builder.generateChunk(output).mappings().size());
        assertThrows(UnsupportedOperationException.class, () -> chunk.mappings().clear());
    }

    @Test
    void rejectsShrinkingOutput() {
        ChunkBuilder builder = new ChunkBuilder("source");
        builder.addNilSourceMapping("abcdef");
        assertThrows(IllegalStateException.class, () -> builder.addNilSourceMapping("abc"));
    }

    @Test
    void identicalConsecutiveMappingsAreRecordedOnce() {
        ChunkBuilder builder = new ChunkBuilder("source");
        builder.addNilSourceMapping("ab");
        builder.addNilSourceMapping("ab");
        assertEquals(1, builder.mappingCount());
    }

    @Test
    void carriageReturnLineFeedCountsAsOneLine() {
        ChunkBuilder builder = new ChunkBuilder("");
        builder.addNilSourceMapping("a\r\nb\rc\nd");
        Mapping mapping = builder.generateChunk("a\r\nb\rc\nd").mappings().get(0);
        assertEquals(3, mapping.generatedLine());
        assertEquals(1, mapping.generatedColumn());
    }

    @Test
    void encodesVersionThreeMappings() {
        String source = "abc\n    x";
        StringBuilder output = new StringBuilder();
        ChunkBuilder builder = new ChunkBuilder(source);
        builder.addSourceMapping(new Loc(0), output);
        output.append("const");
        builder.addNilSourceMapping(output);
        output.append(";\n  ");
        builder.addSourceMapping(new Loc(8), output);
        output.append("x");

        Chunk chunk = builder.generateChunk(output);
        assertEquals("AAAA,K;EACI", chunk.encodeMappings());

        SourceMap map = chunk.toSourceMap("Card.astro.js", "Card.astro", source);
        assertEquals(3, map.version());
        assertEquals(List.of("Card.astro"), map.sources());
        assertEquals(List.of(source), map.sourcesContent());
        assertEquals("AAAA,K;EACI", map.mappings());
    }

    @Test
    void encodesNegativeDeltas() {
        String source = "0123456789\nabcdefghijklmnopqrstuvwxyz";
        StringBuilder output = new StringBuilder();
        ChunkBuilder builder = new ChunkBuilder(source);
        builder.addSourceMapping(new Loc(30), output);
        output.append("xy");
        builder.addSourceMapping(new Loc(3), output);

        // Second segment: column +2, line -1, column 3 - 19 = -16
        assertEquals("AACmB,EADhB", builder.generateChunk(output).encodeMappings());
    }
}
