package info.isaksson.erland.widgettoir.detect;

import info.isaksson.erland.widgettoir.component.PropertyBinding;
import info.isaksson.erland.widgettoir.syntax.CollectionElement;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;

import java.util.List;

/**
 * Pluggable strategy answering classification and accessor queries about syntax nodes.
 *
 * <p>Every method returns {@code null} when the detector has no answer for the node; the
 * {@link DetectorRegistry} then asks the next detector and finally falls back to the documented
 * default. A {@code false} boolean or an empty list also counts as "no answer".</p>
 */
public interface ComponentDetector {

    default Boolean isWidgetCreation(SyntaxNode node) { return null; }

    default Boolean isConditional(SyntaxNode node) { return null; }

    default Boolean isLoop(SyntaxNode node) { return null; }

    default Boolean isCollection(SyntaxNode node) { return null; }

    default Boolean isBuilder(SyntaxNode node) { return null; }

    default Boolean isCallback(SyntaxNode node) { return null; }

    default String getWidgetName(SyntaxNode node) { return null; }

    default String getConstructorName(SyntaxNode node) { return null; }

    default Boolean isConst(SyntaxNode node) { return null; }

    default List<PropertyBinding> getProperties(SyntaxNode node) { return null; }

    default List<CollectionElement> getChildElements(SyntaxNode node) { return null; }

    default String getCondition(SyntaxNode node) { return null; }

    default SyntaxNode getThenBranch(SyntaxNode node) { return null; }

    default SyntaxNode getElseBranch(SyntaxNode node) { return null; }

    default Boolean isTernary(SyntaxNode node) { return null; }

    default String getLoopKind(SyntaxNode node) { return null; }

    default String getLoopVariable(SyntaxNode node) { return null; }

    default String getIterable(SyntaxNode node) { return null; }

    default String getLoopCondition(SyntaxNode node) { return null; }

    default SyntaxNode getLoopBody(SyntaxNode node) { return null; }

    default String getCollectionKind(SyntaxNode node) { return null; }

    default Boolean hasSpread(SyntaxNode node) { return null; }

    default List<CollectionElement> getCollectionElements(SyntaxNode node) { return null; }

    default String getBuilderName(SyntaxNode node) { return null; }

    default List<String> getBuilderParameters(SyntaxNode node) { return null; }

    default Boolean isAsyncBuilder(SyntaxNode node) { return null; }

    default String getCallbackName(SyntaxNode node) { return null; }

    default List<String> getCallbackParameters(SyntaxNode node) { return null; }
}
