package io.intellixity.sift.memory;

import io.intellixity.sift.model.EntityDescriptor;

import java.util.Iterator;

/**
 * Where the in-process interpreter reads entity rows from.\n
 *
 * A session is opened on the first pull of a cursor and closed exactly once when the cursor ends.
 * Rows are positional, in the entity's field order, with values already coerced to the field types.\n
 */
public interface RowSource {
  Session openSession();

  interface Session extends AutoCloseable {
    Iterator<Object[]> scan(EntityDescriptor entity);

    @Override
    void close();
  }
}
