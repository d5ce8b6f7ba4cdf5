package org.medquery.support;

import org.medquery.service.query.QueryResult;
import org.medquery.service.query.StatementExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RecordingStatementExecutor implements StatementExecutor {

    private final List<String> executed = new ArrayList<>();
    private final List<Integer> caps = new ArrayList<>();
    private List<Map<String, Object>> rows = List.of();
    private RuntimeException failure;

    public RecordingStatementExecutor returning(List<Map<String, Object>> rows) {
        this.rows = rows;
        return this;
    }

    public RecordingStatementExecutor failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public QueryResult execute(String statement, int maxRows) {
        executed.add(statement);
        caps.add(maxRows);
        if (failure != null) {
            throw failure;
        }
        boolean truncated = rows.size() > maxRows;
        return new QueryResult(truncated ? rows.subList(0, maxRows) : rows, truncated);
    }

    public List<String> executed() {
        return executed;
    }

    public List<Integer> caps() {
        return caps;
    }
}
