package io.b2mash.maxify.configimport;

import io.b2mash.maxify.configimport.dto.ImportRequest;
import io.b2mash.maxify.configimport.dto.ImportResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/imports")
public class ConfigImportController {

  private final ConfigImportService configImportService;

  public ConfigImportController(ConfigImportService configImportService) {
    this.configImportService = configImportService;
  }

  @PostMapping
  public ResponseEntity<ImportResponse> importConfig(
      @RequestBody(required = false) ImportRequest request) {
    var result =
        request != null
            ? configImportService.importConfig(request.source(), request.strategy())
            : configImportService.importConfig(null, null);
    return ResponseEntity.ok(ImportResponse.from(result));
  }
}
