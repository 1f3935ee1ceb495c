package fasal.servlet.api;

import cn.hutool.core.util.StrUtil;
import fasal.common.exception.RRException;
import fasal.common.exception.ValidationException;
import fasal.common.exception.ValidationReason;
import fasal.config.ContextLoader;
import fasal.config.pojo.UploadConfig;
import fasal.disease.pojo.DetectionRequest;
import fasal.disease.pojo.DetectionResponse;
import fasal.disease.pojo.DiseaseInfo;
import fasal.disease.pojo.ServiceStatus;
import fasal.disease.service.DiseaseDetectionService;
import fasal.listener.DiseaseServiceStartupListener;
import fasal.servlet.RestfulServlet;
import fasal.servlet.annotation.Get;
import fasal.servlet.annotation.Param;
import fasal.servlet.annotation.Post;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.fileupload.FileItem;
import org.apache.commons.fileupload.FileUploadBase;
import org.apache.commons.fileupload.FileUploadException;
import org.apache.commons.fileupload.disk.DiskFileItemFactory;
import org.apache.commons.fileupload.servlet.ServletFileUpload;

import javax.servlet.ServletException;
import javax.servlet.UnavailableException;
import javax.servlet.annotation.WebServlet;
import javax.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@WebServlet("/disease/*")
public class DiseaseDetectionServlet extends RestfulServlet {
    private static final long serialVersionUID = 1L;

    static final String FILE_FIELD = "file";
    static final String CROP_FIELD = "crop_type";
    static final String LOCATION_FIELD = "location";
    private static final long FORM_OVERHEAD_BYTES = 64 * 1024;

    private transient DiseaseDetectionService service;
    private transient UploadConfig uploadConfig;

    @Override
    public void init() throws ServletException {
        super.init();
        service = (DiseaseDetectionService) getServletContext()
                .getAttribute(DiseaseServiceStartupListener.SERVICE_ATTRIBUTE);
        if (service == null) {
            throw new UnavailableException("Disease detection service is not initialised");
        }
        ContextLoader.loadContext();
        uploadConfig = ContextLoader.configuration.getUpload();
    }

    @Post("detect")
    public DetectionResponse detect(HttpServletRequest req) {
        if (!ServletFileUpload.isMultipartContent(req)) {
            throw new RRException(400, "Expected a multipart/form-data upload");
        }
        ServletFileUpload upload = new ServletFileUpload(new DiskFileItemFactory());
        // one byte past the limit so the validator reports the oversize upload
        upload.setFileSizeMax(uploadConfig.getMaxBytes() + 1);
        upload.setSizeMax(uploadConfig.getMaxBytes() + FORM_OVERHEAD_BYTES);
        List<FileItem> items;
        try {
            items = upload.parseRequest(req);
        } catch (FileUploadBase.FileSizeLimitExceededException | FileUploadBase.SizeLimitExceededException e) {
            throw new ValidationException(ValidationReason.TOO_LARGE,
                    "Image exceeds the " + uploadConfig.getMaxBytes() + " byte limit");
        } catch (FileUploadException e) {
            throw new RRException(400, "Malformed multipart request: " + e.getMessage(), e);
        }
        try {
            return service.detect(toDetectionRequest(items));
        } finally {
            items.forEach(FileItem::delete);
        }
    }

    @Get("supportedCrops")
    public List<String> supportedCrops() {
        return service.listSupportedCrops();
    }

    @Get("diseases")
    public List<DiseaseInfo> diseases(@Param("crop") String crop) {
        return service.listKnownDiseases(crop);
    }

    @Get("status")
    public ServiceStatus status() {
        return service.getStatus();
    }

    @Post("reloadModel")
    public ServiceStatus reloadModel() {
        log.info("Classifier reload requested");
        return service.reloadModel();
    }

    static DetectionRequest toDetectionRequest(List<FileItem> items) {
        DetectionRequest.DetectionRequestBuilder builder = DetectionRequest.builder();
        boolean hasFile = false;
        for (FileItem item : items) {
            if (item.isFormField()) {
                String value = StrUtil.trimToNull(new String(item.get(), StandardCharsets.UTF_8));
                if (CROP_FIELD.equals(item.getFieldName())) {
                    builder.cropHint(value);
                } else if (LOCATION_FIELD.equals(item.getFieldName())) {
                    builder.location(value);
                }
            } else if (FILE_FIELD.equals(item.getFieldName())) {
                hasFile = true;
                builder.imageBytes(item.get())
                        .contentType(item.getContentType())
                        .fileName(item.getName());
            }
        }
        if (!hasFile) {
            throw new RRException(400, "Missing '" + FILE_FIELD + "' part");
        }
        return builder.build();
    }
}
