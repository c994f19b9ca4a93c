package io.github.drompincen.clawpoint.persistence.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** SQL text plus positional arguments. Null arguments are allowed and bind as SQL NULL. */
public record SqlStatement(String sql, List<Object> args) {

    public SqlStatement {
        args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
    }

    public static SqlStatement of(String sql, Object... args) {
        return new SqlStatement(sql, Arrays.asList(args));
    }
}
