/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.indextables.segsearch.engine.lucene;

import io.indextables.segsearch.core.FieldCapabilities;
import io.indextables.segsearch.core.Schema;
import io.indextables.segsearch.exception.SchemaMismatchException;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps schema fields onto Lucene fields.
 *
 * <ul>
 *   <li>text: {@link TextField} analyzed with {@link StandardAnalyzer}</li>
 *   <li>exact: {@link StringField}, queried through {@link KeywordAnalyzer}</li>
 *   <li>exact and text: the text field under the schema name plus an exact
 *       twin named {@code name + Schema.EXACT_SUFFIX}</li>
 *   <li>stored only: {@link StoredField}</li>
 * </ul>
 * The value is stored once, on the field carrying the schema name.
 */
final class LuceneFieldMapper {

    private LuceneFieldMapper() {
    }

    static String exactFieldName(String name, FieldCapabilities capabilities) {
        return capabilities.isText() ? name + Schema.EXACT_SUFFIX : name;
    }

    static Document toDocument(Schema schema, Map<String, String> values) {
        Document doc = new Document();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String name = entry.getKey();
            String value = entry.getValue();
            FieldCapabilities capabilities = schema.getFieldCapabilities(name);
            if (capabilities == null) {
                throw new IllegalArgumentException("Field '" + name + "' is not declared in the schema");
            }
            boolean stored = capabilities.isStored();
            if (capabilities.isText()) {
                doc.add(new TextField(name, value, stored ? Field.Store.YES : Field.Store.NO));
                stored = false;
            }
            if (capabilities.isExact()) {
                checkExactLength(name, value);
                doc.add(new StringField(exactFieldName(name, capabilities), value,
                    stored ? Field.Store.YES : Field.Store.NO));
                stored = false;
            }
            if (stored) {
                doc.add(new StoredField(name, value));
            }
        }
        return doc;
    }

    /**
     * An exact value is indexed as one term, bounded by {@link IndexWriter#MAX_TERM_LENGTH}.
     */
    static void checkExactLength(String name, String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        if (length > IndexWriter.MAX_TERM_LENGTH) {
            throw new SchemaMismatchException("Exact field '" + name + "' value is " + length
                + " UTF-8 bytes, the limit is " + IndexWriter.MAX_TERM_LENGTH);
        }
    }

    /**
     * Lucene field names a query is parsed against.
     */
    static String[] queryFields(Schema schema) {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, FieldCapabilities> entry : schema.getFields().entrySet()) {
            FieldCapabilities capabilities = entry.getValue();
            if (capabilities.isText()) {
                fields.add(entry.getKey());
            }
            if (capabilities.isExact()) {
                fields.add(exactFieldName(entry.getKey(), capabilities));
            }
        }
        return fields.toArray(new String[0]);
    }

    static Analyzer analyzer(Schema schema) {
        Map<String, Analyzer> perField = new HashMap<>();
        Analyzer keyword = new KeywordAnalyzer();
        for (Map.Entry<String, FieldCapabilities> entry : schema.getFields().entrySet()) {
            if (entry.getValue().isExact()) {
                perField.put(exactFieldName(entry.getKey(), entry.getValue()), keyword);
            }
        }
        return new PerFieldAnalyzerWrapper(new StandardAnalyzer(), perField);
    }
}
