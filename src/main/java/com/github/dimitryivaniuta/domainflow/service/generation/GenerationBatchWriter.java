package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import com.github.dimitryivaniuta.domainflow.domain.GeneratedDomain;
import com.github.dimitryivaniuta.domainflow.repo.DomainGenerationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.GeneratedDomainRepository;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressDelta;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressMath;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts one reserved range of generated domains together with the campaign's counter update.
 *
 * <p>Names already stored for the campaign are skipped, so replaying the same range after a failed
 * commit inserts nothing twice.</p>
 */
@Service
public class GenerationBatchWriter {

    private final GeneratedDomainRepository domainRepository;
    private final DomainGenerationParamsRepository paramsRepository;
    private final ProgressAggregator progressAggregator;
    private final AppProperties properties;

    public GenerationBatchWriter(GeneratedDomainRepository domainRepository,
                                 DomainGenerationParamsRepository paramsRepository,
                                 ProgressAggregator progressAggregator,
                                 AppProperties properties) {
        this.domainRepository = domainRepository;
        this.paramsRepository = paramsRepository;
        this.progressAggregator = progressAggregator;
        this.properties = properties;
    }

    /**
     * Writes {@code domains}, whose first element sits at {@code firstOffset}.
     *
     * @param campaignId  generation campaign
     * @param domains     enumerated domains in offset order
     * @param firstOffset offset of {@code domains.get(0)}
     * @param elapsed     time spent on the batch
     * @return campaign's generated count after the write
     */
    @Transactional
    public long write(String campaignId, List<String> domains, long firstOffset, Duration elapsed) {
        DomainGenerationParams params = paramsRepository.findById(campaignId)
                .orElseThrow(() -> new InvalidConfigException("Missing generation parameters for campaign " + campaignId));

        Set<String> existing = domains.isEmpty()
                ? new HashSet<>()
                : new HashSet<>(domainRepository.findExistingNames(campaignId, domains));
        List<GeneratedDomain> rows = new ArrayList<>(domains.size());
        for (int i = 0; i < domains.size(); i++) {
            String name = domains.get(i);
            if (existing.add(name)) {
                rows.add(GeneratedDomain.of(campaignId, name, firstOffset + i));
            }
        }
        domainRepository.saveAll(rows);

        int inserted = rows.size();
        params.setGeneratedCount(params.getGeneratedCount() + inserted);
        Double sample = ProgressMath.rate(inserted, elapsed);
        if (sample != null) {
            params.setGenerationRatePerSecond(ProgressMath.ewma(params.getGenerationRatePerSecond(), sample,
                    properties.getGeneration().getRateSmoothing()));
        }
        paramsRepository.save(params);

        progressAggregator.apply(campaignId,
                new ProgressDelta(params.getNumDomainsToGenerate(), inserted, inserted, 0, elapsed));
        return params.getGeneratedCount();
    }
}
