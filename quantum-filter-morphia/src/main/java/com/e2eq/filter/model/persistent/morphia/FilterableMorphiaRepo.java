package com.e2eq.filter.model.persistent.morphia;

import com.e2eq.filter.annotations.FilterFieldSchema;
import com.e2eq.filter.model.persistent.morphia.compiler.mongo.MongoFilterCompiler;
import com.e2eq.filter.model.persistent.morphia.query.CompiledFilter;
import com.e2eq.filter.model.persistent.morphia.query.FilterPipeline;
import com.e2eq.filter.model.persistent.morphia.sanitizer.FilterSanitizer;
import com.e2eq.filter.model.security.SanitizerOptions;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import dev.morphia.Datastore;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Base repository for entities that clients may query with an advanced filter string.
 *
 * <p>Every query is the logical AND of three parts: the repository's permanent filters (by default
 * {@code {isDeleted: false}}), filters supplied by server code for the current context, and the sanitized
 * client filter. Neither of the first two passes through client-facing checks, and the client filter can never
 * override them.</p>
 *
 * @param <T> the Morphia entity type
 */
public abstract class FilterableMorphiaRepo<T> {

   public static final String SOFT_DELETE_FIELD = "isDeleted";

   @Inject
   protected Datastore datastore;

   @Inject
   protected FilterPipeline filterPipeline;

   private volatile FilterFieldSchema entitySchema;
   private volatile MongoFilterCompiler entityCompiler;

   /**
    * @return the persistent entity class handled by this repository
    */
   public abstract Class<T> getPersistentClass();

   /**
    * Conditions added to every query this repository runs.
    */
   protected Map<String, Object> getPermanentFilters() {
      return Map.of(SOFT_DELETE_FIELD, false);
   }

   /**
    * Fields a client filter may never reference, in addition to the policy's protected fields.
    */
   protected Set<String> getProtectedFilterFields() {
      return Set.of(SOFT_DELETE_FIELD);
   }

   /**
    * When present, the only fields a client filter may reference.
    */
   protected Optional<Set<String>> getAllowedFilterFields() {
      return Optional.empty();
   }

   /**
    * Per repository override of the logical nesting limit, {@code null} to use the policy value.
    */
   protected Integer getMaxFilterDepth() {
      return null;
   }

   public SanitizerOptions getFilterOptions() {
      SanitizerOptions defaults = filterPipeline.defaultOptions();
      Set<String> protectedFields = new LinkedHashSet<>(defaults.customProtectedFields());
      protectedFields.addAll(getProtectedFilterFields());
      return SanitizerOptions.builder()
              .policy(defaults.policy())
              .allowedFields(getAllowedFilterFields().orElseGet(() -> defaults.allowedFields().orElse(null)))
              .customProtectedFields(protectedFields)
              .maxDepth(getMaxFilterDepth() != null ? getMaxFilterDepth() : defaults.maxDepth())
              .maxArrayLength(defaults.maxArrayLength())
              .maxStringLength(defaults.maxStringLength())
              .maxObjectKeys(defaults.maxObjectKeys())
              .build();
   }

   protected FilterFieldSchema getFilterSchema() {
      FilterFieldSchema schema = entitySchema;
      if (schema == null) {
         schema = FilterFieldSchema.forModelClass(getPersistentClass());
         entitySchema = schema;
      }
      return schema;
   }

   /**
    * Compiler that resolves identifier fields from the entity's own mapping.
    */
   protected MongoFilterCompiler getFilterCompiler() {
      MongoFilterCompiler compiler = entityCompiler;
      if (compiler == null) {
         compiler = filterPipeline.compiler().withSchema(getFilterSchema());
         entityCompiler = compiler;
      }
      return compiler;
   }

   /**
    * Runs a client filter string through the pipeline with this repository's options.
    */
   public CompiledFilter parseAdvancedFilters(String advancedFilters) {
      return filterPipeline.process(advancedFilters, getFilterOptions(), getFilterCompiler());
   }

   /**
    * Compiles a filter supplied by server code. It is trusted: protected fields are allowed.
    */
   public Document parseContextFilters(Map<String, Object> contextFilters) {
      if (contextFilters == null || contextFilters.isEmpty()) {
         return new Document();
      }
      return filterPipeline.processTrusted(contextFilters);
   }

   /**
    * ANDs the permanent filters with the given parts. Empty parts are skipped; a single remaining part is
    * returned as is.
    */
   public Document applyPermanentFilters(Document... filters) {
      List<Document> parts = new ArrayList<>();
      Document permanent = parseContextFilters(getPermanentFilters());
      if (!permanent.isEmpty()) {
         parts.add(permanent);
      }
      if (filters != null) {
         for (Document filter : filters) {
            if (filter != null && !filter.isEmpty()) {
               parts.add(filter);
            }
         }
      }
      return combine(parts);
   }

   /**
    * Keeps the sort keys a client may use: declared on the entity, not protected, inside the whitelist when there
    * is one. Every dropped key adds a violation.
    */
   public Document sanitizeSort(Document sort, List<String> violations) {
      Document safe = new Document();
      if (sort == null || sort.isEmpty()) {
         return safe;
      }
      SanitizerOptions options = getFilterOptions();
      String marker = options.policy().nativeOperatorMarker();
      for (Map.Entry<String, Object> entry : sort.entrySet()) {
         String field = entry.getKey();
         boolean allowed = !field.contains(marker)
                 && !FilterSanitizer.isProtectedField(field, options)
                 && getFilterSchema().isDeclared(field)
                 && options.allowedFields().map(fields -> fields.contains(field)).orElse(true);
         if (!allowed) {
            violations.add("Sort field not allowed: " + field);
            Log.warnf("Security: sort on %s refused for %s", field, getPersistentClass().getSimpleName());
            continue;
         }
         safe.append(field, entry.getValue());
      }
      return safe;
   }

   static Document combine(List<Document> parts) {
      if (parts.isEmpty()) {
         return new Document();
      }
      if (parts.size() == 1) {
         return parts.get(0);
      }
      return new Document("$and", new ArrayList<>(parts));
   }

   /**
    * @param request         page, page size and sort
    * @param advancedFilters untrusted client filter string, may be {@code null}
    * @param contextFilters  trusted server filters, may be {@code null}
    */
   public PageResult<T> findPaginated(PageRequest request, String advancedFilters, Map<String, Object> contextFilters) {
      PageRequest pageRequest = request == null ? new PageRequest() : request;
      CompiledFilter clientFilter = parseAdvancedFilters(advancedFilters);
      Document contextQuery = parseContextFilters(contextFilters);

      Document query = applyPermanentFilters(contextQuery, clientFilter.query());
      Document totalQuery = applyPermanentFilters(contextQuery);

      List<String> violations = new ArrayList<>(clientFilter.violations());
      Document sort = sanitizeSort(pageRequest.sortDocument(), violations);

      MongoCollection<T> collection = datastore.getCollection(getPersistentClass());
      FindIterable<T> find = collection.find(query)
              .skip(pageRequest.skip())
              .limit(pageRequest.validItemsPerPage());
      if (!sort.isEmpty()) {
         find = find.sort(sort);
      }
      List<T> data = find.into(new ArrayList<>());
      long totalFilteredRows = collection.countDocuments(query);
      long totalRows = collection.countDocuments(totalQuery);

      if (Log.isDebugEnabled()) {
         Log.debugf("%s page %d: %d of %d row(s) match", getPersistentClass().getSimpleName(),
                 pageRequest.validPage(), totalFilteredRows, totalRows);
      }

      return PageResult.<T>builder()
              .data(data)
              .page(pageRequest.validPage())
              .itemsPerPage(pageRequest.validItemsPerPage())
              .totalFilteredRows(totalFilteredRows)
              .totalRows(totalRows)
              .pages(PageResult.pageCount(totalFilteredRows, pageRequest.validItemsPerPage()))
              .filterViolations(violations)
              .build();
   }

   public long count(String advancedFilters) {
      return count(advancedFilters, null);
   }

   public long count(String advancedFilters, Map<String, Object> contextFilters) {
      CompiledFilter clientFilter = parseAdvancedFilters(advancedFilters);
      Document query = applyPermanentFilters(parseContextFilters(contextFilters), clientFilter.query());
      return datastore.getCollection(getPersistentClass()).countDocuments(query);
   }
}
