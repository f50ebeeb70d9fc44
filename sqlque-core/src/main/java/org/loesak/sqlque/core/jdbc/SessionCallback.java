package org.loesak.sqlque.core.jdbc;

import java.sql.SQLException;

@FunctionalInterface
public interface SessionCallback<T> {

    T doInSession(SchemaSession session) throws SQLException;
}
