package com.scholar.api;

import com.scholar.api.dto.ClassificationResponse;
import com.scholar.api.dto.ClassifyRequest;
import com.scholar.api.dto.ModelInfoResponse;
import com.scholar.api.dto.TrainModelsResponse;
import com.scholar.classify.ClassificationService;
import com.scholar.classify.InvalidClassificationRequestException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ClassificationController {
    private final ClassificationService classificationService;

    public ClassificationController(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassificationResponse> classify(@RequestBody(required = false) ClassifyRequest request) {
        if (request == null) {
            throw new InvalidClassificationRequestException("request body is required");
        }
        return ResponseEntity.ok(
            ClassificationResponse.from(classificationService.classify(request.getText(), request.getModelType()))
        );
    }

    @GetMapping("/model-info")
    public ModelInfoResponse modelInfo(@RequestParam(value = "model_type", required = false) String modelType) {
        return ModelInfoResponse.from(classificationService.modelInfo(modelType));
    }

    @PostMapping("/train-models")
    public TrainModelsResponse trainModels() {
        return TrainModelsResponse.from(classificationService.trainModels());
    }
}
