package info.isaksson.erland.widgettoir.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.widgettoir.component.Component;
import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;

import java.util.List;

/**
 * What the service learned about one declaration.
 *
 * <p>{@code body} holds the normalized statements (for a field or top-level variable, its single
 * declaration statement); {@code initializers} the constructor initializer list. {@code components}
 * has one tree per returned expression and is empty unless the declaration produces a widget.</p>
 */
@JsonPropertyOrder({"kind", "name", "qualifiedName", "parent", "location", "producesWidget", "resolved",
        "initializers", "body", "components"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DeclarationRecord {
    public final DeclarationKind kind;
    public final String name;
    public final String qualifiedName;
    /** Enclosing class name, null for top-level declarations. */
    public final String parent;
    public final IrSourceLocation location;
    public final boolean producesWidget;
    /** False when the front-end supplied no element and {@code producesWidget} came from declared type names. */
    public final boolean resolved;
    public final List<IrStatement> initializers;
    public final List<IrStatement> body;
    public final List<Component> components;

    DeclarationRecord(DeclarationKind kind, String name, String parent, IrSourceLocation location,
                      boolean producesWidget, boolean resolved, List<IrStatement> initializers,
                      List<IrStatement> body, List<Component> components) {
        this.kind = kind;
        this.name = name == null ? "" : name;
        this.parent = parent;
        this.qualifiedName = parent == null ? this.name : parent + "." + this.name;
        this.location = location;
        this.producesWidget = producesWidget;
        this.resolved = resolved;
        this.initializers = initializers == null ? List.of() : List.copyOf(initializers);
        this.body = body == null ? List.of() : List.copyOf(body);
        this.components = components == null ? List.of() : List.copyOf(components);
    }

    @Override
    public String toString() {
        return kind.tag() + " " + qualifiedName;
    }
}
