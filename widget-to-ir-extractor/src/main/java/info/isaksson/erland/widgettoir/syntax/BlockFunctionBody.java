package info.isaksson.erland.widgettoir.syntax;

import java.util.List;

public record BlockFunctionBody(Span span, Block block, boolean isAsync, boolean isGenerator) implements FunctionBody {

    public BlockFunctionBody {
        if (block == null) block = new Block(Span.NONE, List.of());
    }
}
