package info.isaksson.erland.widgettoir.element;

/** Resolved type as seen by the widget resolver. */
public sealed interface TypeRef permits InterfaceTypeRef, TypeParameterTypeRef, SpecialTypeRef {

    String displayName();
}
