package info.isaksson.erland.widgettoir.component;

public interface ComponentVisitor<R> {
    R visitWidget(WidgetComponent c);
    R visitConditional(ConditionalComponent c);
    R visitLoop(LoopComponent c);
    R visitCollection(CollectionComponent c);
    R visitBuilder(BuilderComponent c);
    R visitUnsupported(UnsupportedComponent c);
    R visitContainerFallback(ContainerFallbackComponent c);
}
