package com.serialgen.generator.model;

/**
 * Visitor over the closed set of element variants.
 */
public interface ElemVisitor<R> {
    R visit(BaseElem base);
    R visit(PtrElem ptr);
    R visit(StructElem struct);
    R visit(ArrayElem array);
    R visit(SliceElem slice);
    R visit(MapElem map);
}
