package com.portfolioanalysis.optimizer.service;

import com.portfolioanalysis.optimizer.config.DefaultPortfolioProperties;
import com.portfolioanalysis.optimizer.controller.dto.EvaluationRequest;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPageResponse;
import com.portfolioanalysis.optimizer.controller.dto.PortfolioPointResponse;
import com.portfolioanalysis.optimizer.controller.dto.ReturnConvention;
import com.portfolioanalysis.optimizer.controller.dto.SimulationRequest;
import com.portfolioanalysis.optimizer.controller.dto.SimulationResponse;
import com.portfolioanalysis.optimizer.domain.EfficientFrontierSampler;
import com.portfolioanalysis.optimizer.domain.FrontierPopulation;
import com.portfolioanalysis.optimizer.domain.OptimalPortfolioSelector;
import com.portfolioanalysis.optimizer.domain.PortfolioMetricsCalculator;
import com.portfolioanalysis.optimizer.domain.PortfolioPoint;
import com.portfolioanalysis.optimizer.domain.PriceTable;
import com.portfolioanalysis.optimizer.domain.SelectionResolver;
import com.portfolioanalysis.optimizer.domain.SimulationSession;
import com.portfolioanalysis.optimizer.domain.StatisticsBuilder;
import com.portfolioanalysis.optimizer.domain.StatisticsBundle;
import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import com.portfolioanalysis.optimizer.domain.exception.SimulationNotFoundException;
import com.portfolioanalysis.optimizer.infrastructure.SimulationStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Implementation of PortfolioOptimizationService.
 *
 * <p>Each run gets its own {@link SimulationSession}; nothing computed for one run is visible to another.
 * Sampled portfolios report the annualized mean return, evaluated allocations report CAGR, and every
 * response carries a {@link ReturnConvention} saying which one applies.
 *
 * <p>A request without symbols runs on the configured default portfolio, whose weights are then
 * evaluated as the current portfolio.
 */
@Service
@Slf4j
public class PortfolioOptimizationServiceImpl implements PortfolioOptimizationService {

    private static final String MDC_SIMULATION_ID = "simulationId";

    private final PriceHistoryProvider priceHistoryProvider;
    private final StatisticsBuilder statisticsBuilder;
    private final EfficientFrontierSampler frontierSampler;
    private final OptimalPortfolioSelector portfolioSelector;
    private final SelectionResolver selectionResolver;
    private final PortfolioMetricsCalculator metricsCalculator;
    private final SimulationStore simulationStore;
    private final OptimizationMetricsService metricsService;
    private final AssetInfoService assetInfoService;
    private final Map<String, Double> defaultAllocations;
    private final int defaultPortfolios;
    private final double defaultRiskFreeRate;
    private final double defaultEdgeThreshold;

    public PortfolioOptimizationServiceImpl(PriceHistoryProvider priceHistoryProvider,
                                            StatisticsBuilder statisticsBuilder,
                                            EfficientFrontierSampler frontierSampler,
                                            OptimalPortfolioSelector portfolioSelector,
                                            SelectionResolver selectionResolver,
                                            PortfolioMetricsCalculator metricsCalculator,
                                            SimulationStore simulationStore,
                                            OptimizationMetricsService metricsService,
                                            AssetInfoService assetInfoService,
                                            DefaultPortfolioProperties defaultPortfolioProperties,
                                            @Value("${portfolio.frontier.default-portfolios:10000}") int defaultPortfolios,
                                            @Value("${portfolio.frontier.risk-free-rate:0.03}") double defaultRiskFreeRate,
                                            @Value("${portfolio.frontier.edge-threshold:0.001}") double defaultEdgeThreshold) {
        this.priceHistoryProvider = priceHistoryProvider;
        this.statisticsBuilder = statisticsBuilder;
        this.frontierSampler = frontierSampler;
        this.portfolioSelector = portfolioSelector;
        this.selectionResolver = selectionResolver;
        this.metricsCalculator = metricsCalculator;
        this.simulationStore = simulationStore;
        this.metricsService = metricsService;
        this.assetInfoService = assetInfoService;
        this.defaultAllocations = new LinkedHashMap<>(defaultPortfolioProperties.getDefaultAllocations());
        this.defaultPortfolios = defaultPortfolios;
        this.defaultRiskFreeRate = defaultRiskFreeRate;
        this.defaultEdgeThreshold = defaultEdgeThreshold;
    }

    @Override
    public SimulationResponse runSimulation(SimulationRequest request) {
        String simulationId = UUID.randomUUID().toString();
        MDC.put(MDC_SIMULATION_ID, simulationId);

        try {
            SimulationSession session = runSimulationInternal(simulationId, request);
            simulationStore.save(session);

            log.info("Simulation completed with {} portfolios over {}",
                    session.getPopulation().size(), session.getPriceTable().getAssets());
            log.debug("{}", metricsService.getMetricsSummary());

            return buildSummary(session, "Simulation completed");

        } catch (RuntimeException e) {
            metricsService.recordSimulationFailed();
            log.warn("Simulation failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_SIMULATION_ID);
        }
    }

    private SimulationSession runSimulationInternal(String simulationId, SimulationRequest request) {
        List<String> symbols = request.getSymbols();
        Map<String, Double> allocations = request.getAllocations();

        if (symbols == null || symbols.isEmpty()) {
            if (allocations != null && !allocations.isEmpty()) {
                symbols = new ArrayList<>(allocations.keySet());
            } else if (!defaultAllocations.isEmpty()) {
                symbols = new ArrayList<>(defaultAllocations.keySet());
                allocations = defaultAllocations;
                log.info("No symbols requested, using the default portfolio");
            } else {
                throw new IllegalArgumentException("At least one symbol is required");
            }
        }
        log.info("Starting simulation for symbols: {}", symbols);

        PriceHistoryResult history = priceHistoryProvider.loadPriceTable(symbols);
        PriceTable priceTable = history.getPriceTable();

        if (priceTable.columnCount() == 0) {
            throw new InsufficientDataException(
                    "No requested symbol has enough price history: " + history.getExcludedSymbols());
        }

        StatisticsBundle statistics = statisticsBuilder.build(priceTable);

        int numPortfolios = request.getNumPortfolios() != null ? request.getNumPortfolios() : defaultPortfolios;
        double riskFreeRate = request.getRiskFreeRate() != null ? request.getRiskFreeRate() : defaultRiskFreeRate;
        double edgeThreshold = request.getEdgeThreshold() != null ? request.getEdgeThreshold() : defaultEdgeThreshold;
        long seed = request.getSeed() != null ? request.getSeed() : ThreadLocalRandom.current().nextLong();

        // Reject bad holdings before spending time on sampling
        if (allocations != null && !allocations.isEmpty()) {
            metricsCalculator.metrics(priceTable, allocations, riskFreeRate);
        }

        EfficientFrontierSampler sampler = frontierSampler.withSamplingMode(request.getSamplingMode());

        long startTime = System.currentTimeMillis();
        FrontierPopulation population = sampler.sample(statistics, numPortfolios, riskFreeRate, seed);
        long samplingTime = System.currentTimeMillis() - startTime;
        metricsService.recordSimulationCompleted(samplingTime, population.size());

        log.info("Sampled {} portfolios in {} ms (seed={})", population.size(), samplingTime, seed);

        return SimulationSession.builder()
                .id(simulationId)
                .createdAt(LocalDateTime.now())
                .riskFreeRate(riskFreeRate)
                .edgeThreshold(edgeThreshold)
                .samplingMode(sampler.getSamplingMode())
                .seed(seed)
                .requestedSymbols(new ArrayList<>(symbols))
                .excludedSymbols(new ArrayList<>(history.getExcludedSymbols()))
                .allocations(allocations != null ? new LinkedHashMap<>(allocations) : new LinkedHashMap<>())
                .priceTable(priceTable)
                .population(population)
                .build();
    }

    @Override
    public SimulationResponse getSimulation(String simulationId) {
        log.debug("Fetching simulation {}", simulationId);
        return buildSummary(findSession(simulationId), null);
    }

    @Override
    public PortfolioPageResponse getPortfolios(String simulationId, int offset, int limit) {
        SimulationSession session = findSession(simulationId);
        List<String> assets = session.getPriceTable().getAssets();

        List<PortfolioPoint> page = selectionResolver.resolvePage(session.getPopulation(), offset, limit);
        List<PortfolioPointResponse> portfolios = new ArrayList<>(page.size());
        for (int i = 0; i < page.size(); i++) {
            portfolios.add(PortfolioPointResponse.from(page.get(i), assets, offset + i,
                    ReturnConvention.ANNUALIZED_MEAN));
        }

        return PortfolioPageResponse.builder()
                .simulationId(simulationId)
                .offset(offset)
                .limit(limit)
                .total(session.getPopulation().size())
                .portfolios(portfolios)
                .build();
    }

    @Override
    public PortfolioPointResponse resolvePortfolio(String simulationId, int index) {
        SimulationSession session = findSession(simulationId);
        PortfolioPoint point = selectionResolver.resolve(session.getPopulation(), index);
        log.debug("Resolved portfolio {} of simulation {}", index, simulationId);
        return PortfolioPointResponse.from(point, session.getPriceTable().getAssets(), index,
                ReturnConvention.ANNUALIZED_MEAN);
    }

    @Override
    public PortfolioPointResponse evaluateAllocation(String simulationId, EvaluationRequest request) {
        SimulationSession session = findSession(simulationId);
        double riskFreeRate = request.getRiskFreeRate() != null
                ? request.getRiskFreeRate() : session.getRiskFreeRate();

        PortfolioPoint point = metricsCalculator.metrics(session.getPriceTable(), request.getAllocations(),
                riskFreeRate);
        log.info("Evaluated allocation {} on simulation {}: return={}, risk={}",
                request.getAllocations(), simulationId, point.getExpectedReturn(), point.getRisk());

        return PortfolioPointResponse.from(point, session.getPriceTable().getAssets(), null,
                ReturnConvention.CAGR);
    }

    private SimulationSession findSession(String simulationId) {
        return simulationStore.findById(simulationId)
                .orElseThrow(() -> new SimulationNotFoundException(simulationId));
    }

    private SimulationResponse buildSummary(SimulationSession session, String message) {
        PriceTable priceTable = session.getPriceTable();
        List<String> assets = priceTable.getAssets();
        FrontierPopulation population = session.getPopulation();

        StatisticsBundle statistics = statisticsBuilder.build(priceTable);
        Map<String, Double> meanReturns = new LinkedHashMap<>();
        double[] means = statistics.getMeanReturns();
        for (int i = 0; i < assets.size(); i++) {
            meanReturns.put(assets.get(i), means[i]);
        }

        int maxSharpeIndex = portfolioSelector.maxSharpeIndex(population);
        int minRiskIndex = portfolioSelector.minRiskIndex(population);
        List<PortfolioPointResponse> edge = new ArrayList<>();
        for (int index : portfolioSelector.nearMinRiskEdgeIndices(population, session.getEdgeThreshold())) {
            edge.add(PortfolioPointResponse.from(population.get(index), assets, index,
                    ReturnConvention.ANNUALIZED_MEAN));
        }

        PortfolioPointResponse currentPortfolio = null;
        if (session.getAllocations() != null && !session.getAllocations().isEmpty()) {
            PortfolioPoint current = metricsCalculator.metrics(priceTable, session.getAllocations(),
                    session.getRiskFreeRate());
            currentPortfolio = PortfolioPointResponse.from(current, assets, null, ReturnConvention.CAGR);
        }

        return SimulationResponse.builder()
                .simulationId(session.getId())
                .createdAt(session.getCreatedAt())
                .assets(assets)
                .excludedSymbols(session.getExcludedSymbols())
                .startDate(priceTable.getDates().get(0))
                .endDate(priceTable.getDates().get(priceTable.rowCount() - 1))
                .priceRows(priceTable.rowCount())
                .meanReturns(meanReturns)
                .assetSummaries(assetInfoService.summarize(priceTable))
                .samplingMode(session.getSamplingMode())
                .seed(session.getSeed())
                .riskFreeRate(session.getRiskFreeRate())
                .portfolioCount(population.size())
                .maxSharpe(PortfolioPointResponse.from(population.get(maxSharpeIndex), assets, maxSharpeIndex,
                        ReturnConvention.ANNUALIZED_MEAN))
                .minRisk(PortfolioPointResponse.from(population.get(minRiskIndex), assets, minRiskIndex,
                        ReturnConvention.ANNUALIZED_MEAN))
                .minRiskEdge(edge)
                .currentPortfolio(currentPortfolio)
                .message(message)
                .build();
    }
}
