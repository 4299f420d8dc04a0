package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** {@code for}/{@code for-in}/{@code while} producing components; kind is for, forEach or while. */
public final class LoopComponent extends Component {
    public static final String FOR = "for";
    public static final String FOR_EACH = "forEach";
    public static final String WHILE = "while";

    public final String loopKind;
    public final String loopVariable;
    public final String iterableCode;
    public final String conditionCode;
    public final Component bodyComponent;

    public LoopComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                         String loopKind, String loopVariable, String iterableCode, String conditionCode,
                         Component bodyComponent) {
        super(id, location, metadata);
        this.loopKind = loopKind;
        this.loopVariable = loopVariable;
        this.iterableCode = iterableCode;
        this.conditionCode = conditionCode;
        this.bodyComponent = bodyComponent;
    }

    @Override public ComponentType type() {
        return ComponentType.LOOP;
    }

    @Override public String displayName() {
        return loopKind;
    }

    @Override public String describe() {
        return loopKind + (loopVariable != null ? "(" + loopVariable + ")" : "");
    }

    @Override public List<Component> children() {
        return bodyComponent == null ? List.of() : List.of(bodyComponent);
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }

    @Override public LoopComponent withMetadata(Map<String, Object> metadata) {
        return new LoopComponent(id, location, metadata, loopKind, loopVariable, iterableCode, conditionCode, bodyComponent);
    }
}
