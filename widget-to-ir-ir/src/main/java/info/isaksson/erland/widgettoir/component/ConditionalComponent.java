package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code c ? a : b}, {@code if (c) a else b}, and the two shapes modelled through it:
 * cascades (condition {@code cascade}, then = target) and {@code l ?? r} (then = l, else = r).
 */
public final class ConditionalComponent extends Component {
    public final String conditionCode;
    public final Component thenComponent;
    public final Component elseComponent;
    public final boolean isTernary;

    public ConditionalComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                                String conditionCode, Component thenComponent, Component elseComponent,
                                boolean isTernary) {
        super(id, location, metadata);
        this.conditionCode = conditionCode;
        this.thenComponent = thenComponent;
        this.elseComponent = elseComponent;
        this.isTernary = isTernary;
    }

    @Override public ComponentType type() {
        return ComponentType.CONDITIONAL;
    }

    @Override public String displayName() {
        return isTernary ? "ternary" : "if";
    }

    @Override public String describe() {
        return (isTernary ? "?" : "if") + " (" + conditionCode + ") ? ... : ...";
    }

    @Override public List<Component> children() {
        List<Component> out = new ArrayList<>(2);
        if (thenComponent != null) out.add(thenComponent);
        if (elseComponent != null) out.add(elseComponent);
        return List.copyOf(out);
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override public ConditionalComponent withMetadata(Map<String, Object> metadata) {
        return new ConditionalComponent(id, location, metadata, conditionCode, thenComponent, elseComponent, isTernary);
    }
}
