package com.labmuse.formula.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.labmuse.formula.Formula;
import com.labmuse.formula.HighlightedCell;
import com.labmuse.formula.TableData;
import com.labmuse.formula.ValidationResult;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * JSON mapping of engine inputs and outputs.
 * <p>
 * Reads table payloads ({@code {columns, data}}), formula lists and combined
 * highlight requests; writes highlighted cells and validation results pretty-printed.
 */
public class PayloadCodec {

    private static final TypeReference<List<Formula>> FORMULA_LIST = new TypeReference<>() {};
    private static final TypeReference<List<HighlightedCell>> CELL_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PayloadCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public TableData readTable(String json) throws IOException {
        return objectMapper.readValue(json, TableData.class);
    }

    public TableData readTable(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Table file not found: " + file);
        }
        return objectMapper.readValue(file, TableData.class);
    }

    public List<Formula> readFormulas(String json) throws IOException {
        return objectMapper.readValue(json, FORMULA_LIST);
    }

    public List<Formula> readFormulas(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Formula file not found: " + file);
        }
        return objectMapper.readValue(file, FORMULA_LIST);
    }

    public HighlightRequest readRequest(String json) throws IOException {
        return objectMapper.readValue(json, HighlightRequest.class);
    }

    public HighlightRequest readRequest(InputStream in) throws IOException {
        return objectMapper.readValue(in, HighlightRequest.class);
    }

    public List<HighlightedCell> readHighlights(String json) throws IOException {
        return objectMapper.readValue(json, CELL_LIST);
    }

    public String writeHighlights(List<HighlightedCell> cells) throws IOException {
        return objectMapper.writeValueAsString(cells);
    }

    public void writeHighlights(List<HighlightedCell> cells, File file) throws IOException {
        if (file.getParentFile() != null) {
            file.getParentFile().mkdirs();
        }
        objectMapper.writeValue(file, cells);
    }

    public String writeValidation(ValidationResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }

    public String write(Object value) throws IOException {
        return objectMapper.writeValueAsString(value);
    }
}
