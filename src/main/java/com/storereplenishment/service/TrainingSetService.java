package com.storereplenishment.service;

import com.storereplenishment.category.CategoryRuleResolver;
import com.storereplenishment.collector.StoreDataGateway;
import com.storereplenishment.config.EngineProperties;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.dto.TrainingSetResponse;
import com.storereplenishment.exception.ItemDataException;
import com.storereplenishment.exception.RunInputException;
import com.storereplenishment.feature.FeatureEngine;
import com.storereplenishment.forecast.FeatureVectorBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports labelled feature rows for model training, built by the same
 * {@link FeatureVectorBuilder} the live blender uses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingSetService {

    static final int MAX_RANGE_DAYS = 366;

    private final StoreDataGateway storeDataGateway;
    private final FeatureEngine featureEngine;
    private final FeatureVectorBuilder featureVectorBuilder;
    private final CategoryRuleResolver categoryRuleResolver;
    private final EngineProperties properties;

    public TrainingSetResponse trainingSet(String itemId, LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new RunInputException("from must be on or before to");
        }
        if (ChronoUnit.DAYS.between(from, to) >= MAX_RANGE_DAYS) {
            throw new RunInputException("Training range may not exceed " + MAX_RANGE_DAYS + " days");
        }
        String storeId = properties.getStoreId();
        ProductInfo product = storeDataGateway.products().stream()
            .filter(p -> itemId.equals(p.itemId()))
            .findFirst()
            .orElseThrow(() -> new ItemDataException(itemId, "not in product catalog"));
        CategoryGroup group = categoryRuleResolver.resolve(product.categoryCode()).group();

        List<SalesRecord> history = storeDataGateway.salesHistory(
            storeId, itemId, from.minusDays(ItemForecastPipeline.HISTORY_DAYS), to);

        List<TrainingSetResponse.Row> rows = new ArrayList<>();
        for (SalesRecord record : history) {
            LocalDate date = record.date();
            if (date == null || date.isBefore(from) || date.isAfter(to)) {
                continue;
            }
            boolean promotion = storeDataGateway.activePromotion(storeId, itemId, date).isPresent();
            double[] vector = featureVectorBuilder.build(new FeatureVectorBuilder.FeatureInput(
                itemId, date, featureEngine.compute(history, date), group, promotion,
                product.shelfLifeDays(), product.orderUnit(), product.marginRate()));
            rows.add(TrainingSetResponse.Row.builder()
                .date(date)
                .features(vector)
                .target(record.saleQty())
                .build());
        }

        log.info("Training set built | item={} | from={} | to={} | rows={} | features={}",
            itemId, from, to, rows.size(), featureVectorBuilder.featureCount());
        return TrainingSetResponse.builder()
            .itemId(itemId)
            .categoryGroup(group.name())
            .featureNames(FeatureVectorBuilder.FEATURE_NAMES)
            .rows(rows)
            .build();
    }
}
