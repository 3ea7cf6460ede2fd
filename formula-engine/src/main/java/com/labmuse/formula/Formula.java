package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A stored formula as supplied by the caller.
 * <p>
 * JSON uses the persisted field names: the formula text is {@code formula}
 * (also accepted as {@code text}) and the owner table is {@code tableId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Formula {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("formula")
    @JsonAlias("text")
    private String text;

    @JsonProperty("color")
    private String color;

    @JsonProperty("active")
    private boolean active = true;

    @JsonProperty("scope")
    private FormulaScope scope;

    @JsonProperty("tableId")
    private String ownerTableId;

    /**
     * Default constructor for Jackson.
     */
    public Formula() {}

    public Formula(String id, String name, String text, String color) {
        this.id = id;
        this.name = name;
        this.text = text;
        this.color = color;
    }

    public Formula(String id, String name, String text, String color, FormulaScope scope, String ownerTableId) {
        this(id, name, text, color);
        this.scope = scope;
        this.ownerTableId = ownerTableId;
    }

    /**
     * Inactive formulas never apply. Workspace formulas apply to every table,
     * table formulas only to their owner. Unscoped formulas apply when they
     * have no owner or the owner matches. A null table id accepts every active formula.
     */
    public boolean isApplicableTo(String tableId) {
        if (!active) {
            return false;
        }
        if (tableId == null || scope == FormulaScope.WORKSPACE) {
            return true;
        }
        if (scope == FormulaScope.TABLE) {
            return tableId.equals(ownerTableId);
        }
        return ownerTableId == null || tableId.equals(ownerTableId);
    }

    /**
     * Declared scope, or TABLE when unscoped but owned by a table, else WORKSPACE.
     */
    @JsonIgnore
    public FormulaScope getEffectiveScope() {
        if (scope != null) {
            return scope;
        }
        return ownerTableId != null ? FormulaScope.TABLE : FormulaScope.WORKSPACE;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public FormulaScope getScope() {
        return scope;
    }

    public void setScope(FormulaScope scope) {
        this.scope = scope;
    }

    public String getOwnerTableId() {
        return ownerTableId;
    }

    public void setOwnerTableId(String ownerTableId) {
        this.ownerTableId = ownerTableId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula other = (Formula) o;
        return active == other.active && Objects.equals(id, other.id) && Objects.equals(name, other.name)
                && Objects.equals(text, other.text) && Objects.equals(color, other.color)
                && scope == other.scope && Objects.equals(ownerTableId, other.ownerTableId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, text, color, active, scope, ownerTableId);
    }

    @Override
    public String toString() {
        return "Formula{id='" + id + "', name='" + name + "', formula='" + text + "', scope=" + scope + "}";
    }
}
