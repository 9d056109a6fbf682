package com.markovorder.server.service;

import com.markovorder.db.SelectionRecord;
import com.markovorder.db.SelectionResultDao;
import com.markovorder.db.SqliteInitializer;
import com.markovorder.server.ai.data.FeatureSequence;
import com.markovorder.server.ai.data.ObservationBatch;
import com.markovorder.server.ai.data.SequenceDataset;
import com.markovorder.server.ai.data.SequenceDatasetLoader;
import com.markovorder.server.ai.hmm.GaussianHmmTrainer;
import com.markovorder.server.ai.hmm.ModelTrainer;
import com.markovorder.server.ai.hmm.SequenceModel;
import com.markovorder.server.ai.recognition.PredictionRecord;
import com.markovorder.server.ai.recognition.RecognitionResult;
import com.markovorder.server.ai.recognition.Recognizer;
import com.markovorder.server.ai.selection.LoggingSelectionListener;
import com.markovorder.server.ai.selection.ModelSelector;
import com.markovorder.server.ai.selection.SelectionConfig;
import com.markovorder.server.ai.selection.SelectionListener;
import com.markovorder.server.ai.selection.SelectionResult;
import com.markovorder.server.ai.selection.SelectorFactory;
import com.markovorder.server.ai.selection.SelectorType;
import com.markovorder.server.util.DataPathResolver;
import com.markovorder.server.util.SelectionConfigLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Service
public class ModelSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(ModelSelectionService.class);

    private final SelectionConfig config;
    private final ModelTrainer trainer;
    private final SelectionListener listener;
    private final SelectionResultDao resultDao;
    private final Recognizer recognizer = new Recognizer();

    private volatile Map<String, SelectionResult> selections = Collections.emptyMap();
    private volatile Map<String, SequenceModel> models = Collections.emptyMap();
    private volatile boolean isReady = false;

    public ModelSelectionService() {
        this(SelectionConfigLoader.loadOrDefault(), null, null);
    }

    public ModelSelectionService(SelectionConfig config, ModelTrainer trainer, SelectionResultDao resultDao) {
        config.validate();
        this.config = config;
        this.trainer = trainer != null ? trainer : trainerFor(config);
        this.listener = new LoggingSelectionListener();
        this.resultDao = resultDao;
    }

    static ModelTrainer trainerFor(SelectionConfig config) {
        int maxIters = config.maxIterations != null ? config.maxIterations : GaussianHmmTrainer.DEFAULT_MAX_ITERATIONS;
        double tol = config.tolerance != null ? config.tolerance : GaussianHmmTrainer.DEFAULT_TOLERANCE;
        return new GaussianHmmTrainer(maxIters, tol, GaussianHmmTrainer.DEFAULT_MIN_COVAR);
    }

    @PostConstruct
    public void init() {
        new Thread(() -> {
            try {
                logger.info("Initializing Model Selection Service with {}", config);
                String trainingDir = DataPathResolver.resolveTrainingDirectory();
                if (!new File(trainingDir).isDirectory()) {
                    logger.warn("No training directory at {}, selection skipped", trainingDir);
                    return;
                }
                SequenceDataset dataset = new SequenceDatasetLoader().load(trainingDir);
                if (dataset.size() == 0) {
                    logger.error("No training sequences found!");
                    return;
                }
                logger.info("Dataset loaded: {} classes", dataset.size());

                SelectionResultDao dao = resultDao;
                if (dao == null && config.persistResults()) {
                    String dbPath = DataPathResolver.resolveDbPath();
                    SqliteInitializer.initialize(dbPath);
                    logger.info("Initialized SQLite store at {}", dbPath);
                    dao = new SelectionResultDao(dbPath);
                }

                Map<String, SelectionResult> results = selectAll(dataset);
                if (dao != null) {
                    persist(results.values(), dao);
                }
                install(results);
            } catch (Exception e) {
                logger.error("Model selection failed", e);
            }
        }, "model-selection").start();
    }

    public boolean isReady() {
        return isReady;
    }

    public Map<String, SelectionResult> selectAll(SequenceDataset dataset) {
        return selectAll(dataset, SelectorFactory.resolve(config.selector));
    }

    /**
     * Runs one selector per class. The returned map follows dataset order and
     * has an entry for every class, with or without a model.
     */
    public Map<String, SelectionResult> selectAll(SequenceDataset dataset, SelectorType type) {
        logger.info("Selecting models for {} classes with {}", dataset.size(), type.id());
        long startTime = System.currentTimeMillis();

        Map<String, SelectionResult> results = config.parallel()
                ? selectParallel(dataset, type)
                : selectSequential(dataset, type);

        int fallbacks = 0;
        int missing = 0;
        for (SelectionResult r : results.values()) {
            if (r.isFallback()) {
                fallbacks++;
            }
            if (!r.hasModel()) {
                missing++;
            }
        }
        long duration = System.currentTimeMillis() - startTime;
        logger.info("Selection complete in {} ms: {} classes, {} fallbacks, {} without model", duration,
                results.size(), fallbacks, missing);
        return results;
    }

    private Map<String, SelectionResult> selectSequential(SequenceDataset dataset, SelectorType type) {
        Map<String, SelectionResult> results = new LinkedHashMap<>();
        for (String label : dataset.labels()) {
            results.put(label, selectOne(dataset, label, type));
        }
        return results;
    }

    private Map<String, SelectionResult> selectParallel(SequenceDataset dataset, SelectorType type) {
        int threads = Math.max(1, Math.min(dataset.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        Map<String, SelectionResult> collected = new ConcurrentHashMap<>();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String label : dataset.labels()) {
                futures.add(pool.submit(() -> {
                    collected.putIfAbsent(label, selectOne(dataset, label, type));
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while selecting models", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Selection worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        Map<String, SelectionResult> ordered = new LinkedHashMap<>();
        for (String label : dataset.labels()) {
            ordered.put(label, collected.get(label));
        }
        return ordered;
    }

    private SelectionResult selectOne(SequenceDataset dataset, String label, SelectorType type) {
        ModelSelector selector = SelectorFactory.create(type, dataset, label, trainer, config, listener);
        try {
            SelectionResult result = selector.select();
            logger.debug("{}", result);
            return result;
        } catch (RuntimeException e) {
            // a broken class must not stop the others
            logger.error("Selector {} crashed for class {}", type.id(), label, e);
            return SelectionResult.noModel(label, type.id(), config.minStates(), new double[0]);
        }
    }

    /**
     * Class label to selected model; classes without a model map to null so
     * the recognizer still reports them.
     */
    public static Map<String, SequenceModel> modelMap(Map<String, SelectionResult> results) {
        Map<String, SequenceModel> map = new LinkedHashMap<>();
        for (Map.Entry<String, SelectionResult> e : results.entrySet()) {
            map.put(e.getKey(), e.getValue().getModel().orElse(null));
        }
        return map;
    }

    public void install(Map<String, SelectionResult> results) {
        this.selections = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.models = Collections.unmodifiableMap(modelMap(results));
        this.isReady = true;
    }

    public Map<String, SelectionResult> getSelections() {
        return selections;
    }

    public void persist(Iterable<SelectionResult> results, SelectionResultDao dao) {
        for (SelectionResult r : results) {
            try {
                dao.upsert(SelectionRecord.of(r));
            } catch (SQLException e) {
                logger.error("Failed to persist selection for {}", r.getClassLabel(), e);
            }
        }
    }

    public void persist(Iterable<SelectionResult> results) {
        if (resultDao == null) {
            throw new IllegalStateException("No selection store configured");
        }
        persist(results, resultDao);
    }

    public void clearSelections(String selectorName) {
        if (resultDao == null) {
            throw new IllegalStateException("No selection store configured");
        }
        try {
            resultDao.deleteBySelector(selectorName);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear stored selections for " + selectorName, e);
        }
    }

    public RecognitionResult recognize(List<ObservationBatch> items) {
        return recognizer.recognize(models, items);
    }

    public PredictionRecord recognize(FeatureSequence sequence) {
        return recognizer.recognize(0, models, ObservationBatch.of(sequence));
    }
}
