package com.moonshift.compiler.ast.stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明名：{@code root.field1.field2:method}
 */
public class FunctionName {
    private final String root;
    private final List<String> fields;
    private final String method;  // 可选

    public FunctionName(String root) {
        this(root, Collections.emptyList(), null);
    }

    public FunctionName(String root, List<String> fields, String method) {
        this.root = root;
        this.fields = new ArrayList<>(fields);
        this.method = method;
    }

    public String getRoot() {
        return root;
    }

    public List<String> getFields() {
        return fields;
    }

    public String getMethod() {
        return method;
    }

    public boolean hasMethod() {
        return method != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(root);
        for (String field : fields) {
            sb.append('.').append(field);
        }
        if (method != null) {
            sb.append(':').append(method);
        }
        return sb.toString();
    }
}
