package com.project.image.charge.controller;

import com.project.image.charge.DTOs.ChargeFieldResult;
import com.project.image.charge.DTOs.ChargeParameters;
import com.project.image.charge.DTOs.ChargeWeights;
import com.project.image.charge.DTOs.FieldView;
import com.project.image.charge.DTOs.ScalarField;
import com.project.image.charge.exceptions.InvalidInputException;
import com.project.image.charge.exceptions.InvalidParameterException;
import com.project.image.charge.service.AestheticFieldComputer;
import com.project.image.charge.service.Colormap;
import com.project.image.charge.service.HeatmapRenderer;
import com.project.image.charge.service.ImageDecoder;
import com.project.image.charge.service.OpenCVAestheticFieldComputer;
import com.project.image.charge.service.StorageService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Controller
@Validated
public class ChargeFieldController {
    private static final Logger log = LoggerFactory.getLogger(ChargeFieldController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp"
    );
    private static final List<String> ENGINES = Arrays.asList("java", "opencv");
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB
    private static final int MAX_KERNEL_SIZE = 99;

    private final AestheticFieldComputer fieldComputer;
    private final OpenCVAestheticFieldComputer openCvFieldComputer;
    private final ImageDecoder imageDecoder;
    private final HeatmapRenderer heatmapRenderer;
    private final StorageService storageService;

    @Value("${app.charge.default-kernel-size:5}")
    private int defaultKernelSize;

    @Value("${app.charge.default-weights:1.0,1.0,1.0,0.5,0.3}")
    private String defaultWeights;

    public ChargeFieldController(AestheticFieldComputer fieldComputer,
                                 OpenCVAestheticFieldComputer openCvFieldComputer,
                                 ImageDecoder imageDecoder,
                                 HeatmapRenderer heatmapRenderer,
                                 StorageService storageService) {
        this.fieldComputer = fieldComputer;
        this.openCvFieldComputer = openCvFieldComputer;
        this.imageDecoder = imageDecoder;
        this.heatmapRenderer = heatmapRenderer;
        this.storageService = storageService;
    }

    @GetMapping("/charge")
    public String showForm(Model model) {
        populateForm(model);
        return "charge";
    }

    @PostMapping(value = "/charge", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "kernelSize", required = false) String kernelSize,
            @RequestParam(name = "weights", required = false) List<String> weights,
            @RequestParam(name = "engine", defaultValue = "java") String engine,
            @RequestParam(name = "colormap", defaultValue = "inferno") String colormap,
            @RequestParam(name = "view", defaultValue = "charge") String view,
            Model model
    ) throws IOException {

        try {
            validateUploadedFile(file);

            // Everything is parsed before the upload is stored or decoded
            ChargeParameters parameters = new ChargeParameters(parseKernelSize(kernelSize), toWeights(weights));
            String engineName = parseEngine(engine);
            Colormap map = Colormap.fromParam(colormap);
            FieldView fieldView = FieldView.fromParam(view);

            log.info("Processing file: {} ({}KB), kernelSize={}, engine={}, view={}",
                    file.getOriginalFilename(), file.getSize() / 1024, parameters.kernelSize(), engineName, fieldView);

            var storedOriginal = storageService.store(file);
            log.debug("File stored as: {}", storedOriginal.filename());

            BufferedImage input = imageDecoder.decode(file.getBytes());

            ChargeFieldResult result = "opencv".equals(engineName)
                    ? openCvFieldComputer.compute(input, parameters)
                    : fieldComputer.compute(input, parameters);

            byte[] heatmapPng = heatmapRenderer.renderPng(result.view(fieldView), map);
            var storedHeatmap = storageService.storeResultImage(heatmapPng, fieldView.param());

            populateResultModel(model, storedOriginal, storedHeatmap, result, engineName, map, fieldView);

            log.info("Charge field completed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (InvalidParameterException | InvalidInputException e) {
            log.warn("Charge field rejected for {}: {}", file.getOriginalFilename(), e.getMessage());
            populateForm(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", getSuggestionForError(e));
            return "charge";
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("Please choose an image to upload.");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new InvalidInputException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        // On top of spring.servlet.multipart.max-file-size
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new InvalidInputException("File is too large. Maximum size: 10MB");
        }
    }

    private int parseKernelSize(String kernelSize) {
        if (kernelSize == null || kernelSize.isBlank()) {
            return defaultKernelSize;
        }
        int k;
        try {
            k = Integer.parseInt(kernelSize.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Kernel size is not a whole number: '" + kernelSize.trim() + "'");
        }
        if (k > MAX_KERNEL_SIZE) {
            throw new InvalidParameterException("Kernel size cannot be larger than " + MAX_KERNEL_SIZE + ", got " + k);
        }
        return k;
    }

    private ChargeWeights toWeights(List<String> weights) {
        if (weights == null || weights.isEmpty()) {
            return ChargeWeights.parse(defaultWeights);
        }
        for (int i = 0; i < weights.size(); i++) {
            if (weights.get(i) == null || weights.get(i).isBlank()) {
                throw new InvalidParameterException("Weight #" + (i + 1) + " is missing");
            }
        }
        // A single comma-separated value is accepted as well as one value per field
        return ChargeWeights.parse(String.join(",", weights));
    }

    private static String parseEngine(String engine) {
        String name = engine == null ? "" : engine.trim().toLowerCase(Locale.ROOT);
        if (!ENGINES.contains(name)) {
            throw new InvalidParameterException("Unknown engine: " + engine + ". Supported engines: " + String.join(", ", ENGINES));
        }
        return name;
    }

    private void populateForm(Model model) {
        model.addAttribute("defaultKernelSize", defaultKernelSize);
        model.addAttribute("defaultWeights", ChargeWeights.parse(defaultWeights).toArray());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        model.addAttribute("engines", ENGINES);
        model.addAttribute("openCvAvailable", OpenCVAestheticFieldComputer.isAvailable());
        model.addAttribute("colormaps", Arrays.stream(Colormap.values()).map(Colormap::param).toList());
        model.addAttribute("views", Arrays.stream(FieldView.values()).map(FieldView::param).toList());
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile heatmap, ChargeFieldResult result,
                                     String engine, Colormap colormap, FieldView view) {

        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("heatmapPath", "/" + heatmap.relativeWebPath());

        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
        model.addAttribute("kernelSize", result.parameters().kernelSize());
        model.addAttribute("weights", result.parameters().weights().toString());
        model.addAttribute("engine", engine);
        model.addAttribute("colormap", colormap.param());
        model.addAttribute("view", view.param());

        ScalarField field = result.field();
        model.addAttribute("entropy", String.format(Locale.ROOT, "%.4f", result.components().entropy()));
        model.addAttribute("minCharge", String.format(Locale.ROOT, "%.3f", field.min()));
        model.addAttribute("maxCharge", String.format(Locale.ROOT, "%.3f", field.max()));
        model.addAttribute("meanCharge", String.format(Locale.ROOT, "%.3f", field.mean()));
    }

    private String getSuggestionForError(RuntimeException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.contains("Kernel size")) {
            return "Use an odd kernel size such as 3, 5 or 7.";
        } else if (message.contains("Weight")) {
            return "Enter five non-negative weights: L, a, b, curvature, entropy.";
        } else if (message.contains("corrupted")) {
            return "Try another image in PNG or JPEG format.";
        } else if (message.contains("too large")) {
            return "Upload a smaller image.";
        }
        return "Try different parameters or another image.";
    }
}
