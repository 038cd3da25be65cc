package com.docbridge.adapter.mongodb;

import com.docbridge.adapter.spi.ItemQuery;
import com.docbridge.partition.PartitionKeyValue;
import com.mongodb.client.model.Filters;
import org.bson.BsonValue;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a parsed {@link ItemQuery} into a MongoDB filter scoped to one partition.
 *
 * <p>Every condition also requires its field to exist, so a missing field never
 * matches, not even {@code != } or {@code = null}.
 */
final class MongoQueryTranslator {

    private MongoQueryTranslator() {
    }

    static Bson toFilter(ItemQuery query, PartitionKeyValue partitionKey) {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.eq("_id.pk", BsonNodes.toBson(partitionKey.toJson())));
        for (ItemQuery.Condition condition : query.conditions()) {
            String field = condition.dottedPath();
            BsonValue literal = BsonNodes.toBson(condition.literal());
            filters.add(Filters.exists(field));
            filters.add(comparison(condition.comparison(), field, literal));
        }
        return Filters.and(filters);
    }

    private static Bson comparison(ItemQuery.Comparison comparison, String field, BsonValue literal) {
        switch (comparison) {
            case EQ:
                return Filters.eq(field, literal);
            case NE:
                return Filters.ne(field, literal);
            case LT:
                return Filters.lt(field, literal);
            case LE:
                return Filters.lte(field, literal);
            case GT:
                return Filters.gt(field, literal);
            case GE:
                return Filters.gte(field, literal);
            default:
                throw new IllegalStateException("Unknown comparison " + comparison);
        }
    }
}
