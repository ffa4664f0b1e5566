package com.jsprinter.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsprinter.ast.Document;
import com.jsprinter.ast.Node;
import com.jsprinter.json.*;
import com.jsprinter.printer.TransformOptions;
import com.jsprinter.sourcemap.SourceMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-based implementation of DocumentJsonProvider.
 */
public class JacksonDocumentJsonProvider implements DocumentJsonProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(JacksonDocumentJsonProvider.class);

    private final ObjectMapper mapper;
    private final DocumentJsonSerializer serializer;
    private final DocumentJsonDeserializer deserializer;
    private final SourceMapJsonSerializer sourceMapSerializer;

    public JacksonDocumentJsonProvider() {
        this(CadenzaJackson.createObjectMapper());
    }

    public JacksonDocumentJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
        this.sourceMapSerializer = new JacksonSourceMapSerializer(mapper);
    }

    @Override
    public DocumentJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public DocumentJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public SourceMapJsonSerializer getSourceMapSerializer() {
        return sourceMapSerializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements DocumentJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws DocumentJsonException {
            try {
                return mapper.writerFor(Node.class).writeValueAsString(node);
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to serialize node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws DocumentJsonException {
            try {
                return mapper.writerFor(Node.class).withDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to serialize node", e);
            }
        }
    }

    private static class JacksonDeserializer implements DocumentJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Document deserializeDocument(String json) throws DocumentJsonException {
            try {
                Document document = mapper.readValue(json, Document.class);
                LOGGER.debug("Read document with {} top-level nodes, {} client-only components",
                    document.children().size(), document.clientOnlyComponents().size());
                return document;
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to deserialize Document", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws DocumentJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }

        @Override
        public TransformOptions deserializeOptions(String json) throws DocumentJsonException {
            try {
                return mapper.readValue(json, TransformOptions.class);
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to deserialize TransformOptions", e);
            }
        }
    }

    private static class JacksonSourceMapSerializer implements SourceMapJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSourceMapSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SourceMap sourceMap) throws DocumentJsonException {
            try {
                return mapper.writeValueAsString(sourceMap);
            } catch (Exception e) {
                throw new DocumentJsonException("Failed to serialize source map", e);
            }
        }
    }
}
