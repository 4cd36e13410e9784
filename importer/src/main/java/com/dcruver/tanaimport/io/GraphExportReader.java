package com.dcruver.tanaimport.io;

import com.dcruver.tanaimport.domain.GraphExport;
import com.dcruver.tanaimport.domain.GraphNode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON text of a Tana export into graph nodes.
 * Only the fields the converter needs are read; everything else is ignored.
 */
@Slf4j
public class GraphExportReader {

    private final ObjectMapper objectMapper;

    public GraphExportReader() {
        this(new ObjectMapper());
    }

    public GraphExportReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GraphExport parse(String data) {
        ExportRecord record;
        try {
            record = objectMapper.readValue(data, ExportRecord.class);
        } catch (JsonProcessingException e) {
            throw new GraphFormatException("Could not parse export: " + e.getOriginalMessage(), e);
        }
        if (record == null || record.getDocs() == null) {
            throw new GraphFormatException("Export contains no docs array");
        }

        List<GraphNode> nodes = new ArrayList<>(record.getDocs().size());
        for (DocRecord doc : record.getDocs()) {
            if (doc == null || doc.getId() == null) {
                log.debug("Skipping doc without id");
                continue;
            }
            nodes.add(toNode(doc));
        }
        return new GraphExport(record.getFormatVersion(), nodes);
    }

    private GraphNode toNode(DocRecord doc) {
        PropsRecord props = doc.getProps() != null ? doc.getProps() : new PropsRecord();
        GraphNode.GraphNodeBuilder builder = GraphNode.builder()
            .id(doc.getId())
            .name(props.getName())
            .description(props.getDescription())
            .docType(props.getDocType())
            .ownerId(props.getOwnerId())
            .metaNodeId(props.getMetaNodeId())
            .flags(props.getFlags())
            .done(props.getDone() != null && props.getDone().asBoolean())
            .created(props.getCreated());
        if (doc.getChildren() != null) {
            doc.getChildren().stream().filter(id -> id != null).forEach(builder::child);
        }
        if (doc.getAssociationMap() != null) {
            doc.getAssociationMap().forEach((key, target) -> {
                if (target != null) {
                    builder.association(key, target);
                }
            });
        }
        return builder.build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ExportRecord {
        private Integer formatVersion;
        private List<DocRecord> docs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DocRecord {
        private String id;
        private PropsRecord props;
        private List<String> children;
        private Map<String, String> associationMap;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PropsRecord {
        private String name;
        private String description;
        private Long created;
        @JsonProperty("_docType")
        private String docType;
        @JsonProperty("_ownerId")
        private String ownerId;
        @JsonProperty("_metaNodeId")
        private String metaNodeId;
        @JsonProperty("_flags")
        private Integer flags;
        // Timestamp or boolean depending on export version
        @JsonProperty("_done")
        private JsonNode done;
    }
}
