package info.isaksson.erland.widgettoir.component;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;

import java.util.List;
import java.util.Map;

/** Expression the extractor could not model; keeps the source text and the reason. */
public final class UnsupportedComponent extends Component {
    public final String sourceCode;
    public final String reason;

    public UnsupportedComponent(String id, IrSourceLocation location, Map<String, Object> metadata,
                                String sourceCode, String reason) {
        super(id, location, metadata);
        this.sourceCode = sourceCode == null ? "" : sourceCode;
        this.reason = reason;
    }

    @Override public ComponentType type() {
        return ComponentType.UNSUPPORTED;
    }

    @Override public String displayName() {
        return "unsupported";
    }

    @Override public String describe() {
        return "UNSUPPORTED: " + sourceCode;
    }

    @Override public List<Component> children() {
        return List.of();
    }

    @Override public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }

    @Override public UnsupportedComponent withMetadata(Map<String, Object> metadata) {
        return new UnsupportedComponent(id, location, metadata, sourceCode, reason);
    }
}
