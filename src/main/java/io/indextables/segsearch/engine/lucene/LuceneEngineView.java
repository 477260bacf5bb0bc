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

import io.indextables.segsearch.core.Schema;
import io.indextables.segsearch.engine.EngineHit;
import io.indextables.segsearch.engine.EngineView;
import io.indextables.segsearch.exception.EngineException;
import io.indextables.segsearch.exception.InvalidQueryException;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.MultiReader;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link IndexSearcher} over a {@link MultiReader} of segment readers. The
 * multi reader holds a reference on each segment reader; closing the view
 * drops those references and leaves the segments open.
 */
final class LuceneEngineView implements EngineView {
    private final Schema schema;
    private final MultiReader reader;
    private final IndexSearcher searcher;
    private final String[] queryFields;
    private final Analyzer analyzer;

    LuceneEngineView(Schema schema, MultiReader reader) {
        this.schema = schema;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.queryFields = LuceneFieldMapper.queryFields(schema);
        this.analyzer = LuceneFieldMapper.analyzer(schema);
    }

    @Override
    public List<EngineHit> search(String query, int limit, Set<String> fields) {
        if (limit <= 0 || queryFields.length == 0 || query.isBlank()) {
            return Collections.emptyList();
        }
        Query parsed = parse(query);
        try {
            TopDocs top = searcher.search(parsed, limit);
            StoredFields storedFields = searcher.storedFields();
            List<EngineHit> hits = new ArrayList<>(top.scoreDocs.length);
            for (ScoreDoc scoreDoc : top.scoreDocs) {
                Document doc = storedFields.document(scoreDoc.doc, fields);
                Map<String, String> values = new LinkedHashMap<>();
                for (String field : schema.getFieldNames()) {
                    String value = fields.contains(field) ? doc.get(field) : null;
                    if (value != null) {
                        values.put(field, value);
                    }
                }
                hits.add(new EngineHit(scoreDoc.score, values));
            }
            return hits;
        } catch (IndexSearcher.TooManyClauses e) {
            throw new InvalidQueryException("Query expands to too many clauses: " + query, e);
        } catch (IOException | AlreadyClosedException e) {
            throw new EngineException("Search failed for query: " + query, e);
        }
    }

    private Query parse(String query) {
        // parsers are not thread-safe; one per call
        MultiFieldQueryParser parser = new MultiFieldQueryParser(queryFields, analyzer);
        try {
            return parser.parse(query);
        } catch (ParseException e) {
            throw new InvalidQueryException("Cannot parse query '" + query + "': " + e.getMessage(), e);
        } catch (IndexSearcher.TooManyClauses e) {
            throw new InvalidQueryException("Query expands to too many clauses: " + query, e);
        }
    }

    @Override
    public int getNumDocs() {
        return reader.numDocs();
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            throw new EngineException("Failed to close search view", e);
        }
    }
}
