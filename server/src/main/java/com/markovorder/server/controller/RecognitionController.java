package com.markovorder.server.controller;

import com.markovorder.server.ai.data.FeatureSequence;
import com.markovorder.server.ai.recognition.PredictionRecord;
import com.markovorder.server.ai.selection.SelectionResult;
import com.markovorder.server.service.ModelSelectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class RecognitionController {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionController.class);
    private final ModelSelectionService selectionService;

    public RecognitionController(ModelSelectionService selectionService) {
        this.selectionService = selectionService;
    }

    public static class RecognitionRequest {
        public double[][] frames;
    }

    public static class RecognitionResponse {
        public String guess;
        public Map<String, Double> logLikelihoods;

        static RecognitionResponse from(PredictionRecord record) {
            RecognitionResponse r = new RecognitionResponse();
            r.guess = record.getBestGuess().orElse(null);
            r.logLikelihoods = record.getLogLikelihoods();
            return r;
        }
    }

    @PostMapping("/recognize")
    public ResponseEntity<?> recognize(@RequestBody RecognitionRequest request) {
        if (!selectionService.isReady()) {
            return ResponseEntity.status(503).body("Models are still being selected, please try again later.");
        }
        if (request == null || request.frames == null || request.frames.length == 0) {
            return ResponseEntity.badRequest().body("Request must contain at least one frame.");
        }

        FeatureSequence sequence;
        try {
            sequence = new FeatureSequence(request.frames);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        logger.info("Received recognition request with {} frames.", sequence.getFrameCount());
        PredictionRecord record = selectionService.recognize(sequence);
        return ResponseEntity.ok(RecognitionResponse.from(record));
    }

    @GetMapping("/selections")
    public ResponseEntity<?> selections() {
        if (!selectionService.isReady()) {
            return ResponseEntity.status(503).body("Models are still being selected, please try again later.");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<String, SelectionResult> e : selectionService.getSelections().entrySet()) {
            SelectionResult r = e.getValue();
            counts.put(e.getKey(), r.getSelectedStateCount().isPresent() ? r.getSelectedStateCount().getAsInt() : null);
        }
        return ResponseEntity.ok(counts);
    }
}
