package org.tempo.smt;

import com.microsoft.z3.Sort;

/**
 * <p>The type of a route or symbolic value. A type knows how to build
 * its Z3 sort in an encoder's context.</p>
 *
 * <p>Callers should go through {@link Encoder#getSort(SmtType)}, which
 * builds every sort at most once per context. Implementations must
 * therefore provide value-based {@code equals} and {@code hashCode}.</p>
 */
public interface SmtType {

    String getName();

    Sort mkSort(Encoder enc);

}
