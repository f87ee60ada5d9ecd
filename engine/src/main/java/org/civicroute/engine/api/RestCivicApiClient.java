package org.civicroute.engine.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.civicroute.engine.api.dto.AssignmentUpdateDto;
import org.civicroute.engine.api.dto.CountDto;
import org.civicroute.engine.api.dto.EventDto;
import org.civicroute.engine.api.dto.HandlingUnitDto;
import org.civicroute.engine.api.dto.NotificationDto;
import org.civicroute.engine.api.dto.TimelineEntryDto;
import org.civicroute.engine.api.dto.WorkItemDto;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.TimelineEntry;
import org.civicroute.engine.domain.model.WorkItem;
import org.civicroute.engine.exception.NotFoundException;
import org.civicroute.engine.exception.PersistenceException;
import org.civicroute.engine.exception.RegistryLoadException;
import org.civicroute.engine.exception.WorkloadQueryException;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.PUT;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based client for the civic issues API. Implements every external
 * collaborator the engine needs over one HTTP connection pool.
 */
public final class RestCivicApiClient implements ItemRepository, HandlingUnitRepository, NotificationSink, EventPublisher {

    private static final Logger LOG = Logger.getLogger(RestCivicApiClient.class.getName());

    private final CivicApiService api;

    public RestCivicApiClient(String baseUrl, String apiToken, Duration timeout) {
        this(createService(baseUrl, apiToken, timeout));
    }

    RestCivicApiClient(CivicApiService api) {
        this.api = Objects.requireNonNull(api, "api must not be null");
    }

    private static CivicApiService createService(String baseUrl, String apiToken, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout);
        if (apiToken != null && !apiToken.trim().isEmpty()) {
            clientBuilder.addInterceptor(new AuthInterceptor(apiToken.trim()));
        }

        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(mapper))
                .client(clientBuilder.build())
                .build();

        return retrofit.create(CivicApiService.class);
    }

    @Override
    public Optional<WorkItem> find(String itemId) {
        WorkItemDto dto = execute(api.getIssue(itemId), "GET /issues/" + itemId, PersistenceException::new);
        return dto != null ? Optional.of(dto.toDomain()) : Optional.empty();
    }

    @Override
    public int countOpenByUnit(String unitId) {
        return count(api.countOpen(unitId, null), "GET /issues/open-count?department=" + unitId);
    }

    @Override
    public int countOpenByStaff(String staffId) {
        return count(api.countOpen(null, staffId), "GET /issues/open-count?worker=" + staffId);
    }

    @Override
    public void updateAssignment(String itemId, Assignment assignment, ItemStatus status, TimelineEntry entry) {
        String description = "PUT /issues/" + itemId + "/assignment";
        Response<Void> response = send(api.updateAssignment(itemId, AssignmentUpdateDto.of(assignment, status, entry)),
                description, PersistenceException::new);
        requireWritten(response, itemId, description);
    }

    @Override
    public void clearAssignment(String itemId, TimelineEntry entry) {
        String description = "POST /issues/" + itemId + "/unassign";
        Response<Void> response = send(api.clearAssignment(itemId, TimelineEntryDto.from(entry)),
                description, PersistenceException::new);
        requireWritten(response, itemId, description);
    }

    @Override
    public List<HandlingUnit> findAllActive() {
        List<HandlingUnitDto> dtos = execute(api.getActiveDepartments(), "GET /departments?active=true",
                RegistryLoadException::new);
        if (dtos == null) {
            throw new RegistryLoadException("GET /departments?active=true returned no body");
        }
        List<HandlingUnit> units = new ArrayList<>(dtos.size());
        for (HandlingUnitDto dto : dtos) {
            if (dto == null) {
                continue;
            }
            try {
                units.add(dto.toDomain());
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, e, () -> "[API] Skipping malformed department " + dto.getId());
            }
        }
        return Collections.unmodifiableList(units);
    }

    @Override
    public void notify(String userId, String type, String title, String message, Map<String, Object> data) {
        try {
            Response<Void> response = api.createNotification(new NotificationDto(userId, type, title, message, data))
                    .execute();
            if (!response.isSuccessful()) {
                LOG.warning(() -> String.format("[API] POST /notifications failed: %d %s",
                        response.code(), response.message()));
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "[API] POST /notifications error", e);
        }
    }

    @Override
    public void publish(String eventName, Map<String, Object> payload) {
        try {
            Response<Void> response = api.publishEvent(new EventDto(eventName, payload)).execute();
            if (!response.isSuccessful()) {
                LOG.warning(() -> String.format("[API] POST /events (%s) failed: %d %s",
                        eventName, response.code(), response.message()));
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "[API] POST /events (" + eventName + ") error", e);
        }
    }

    private int count(Call<CountDto> call, String description) {
        CountDto dto = execute(call, description, WorkloadQueryException::new);
        if (dto == null || dto.getCount() == null) {
            throw new WorkloadQueryException(description + " returned no count");
        }
        return dto.getCount();
    }

    private static void requireWritten(Response<Void> response, String itemId, String description) {
        if (response.code() == 404) {
            throw NotFoundException.item(itemId);
        }
        if (!response.isSuccessful()) {
            throw new PersistenceException(String.format("%s failed: %d %s",
                    description, response.code(), response.message()));
        }
    }

    /**
     * Execute a Retrofit call and return the body. 404 yields null; other failures throw.
     */
    private <T> T execute(Call<T> call, String description,
                          BiFunction<String, Throwable, ? extends RuntimeException> failure) {
        Response<T> response = send(call, description, failure);
        if (response.isSuccessful()) {
            return response.body();
        }
        if (response.code() == 404) {
            return null;
        }
        String message = String.format("[API] %s failed: %d %s", description, response.code(), response.message());
        LOG.warning(message);
        throw failure.apply(message, null);
    }

    private <T> Response<T> send(Call<T> call, String description,
                                 BiFunction<String, Throwable, ? extends RuntimeException> failure) {
        try {
            return call.execute();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            throw failure.apply("[API] " + description + " error: " + e.getMessage(), e);
        }
    }

    /**
     * Retrofit service interface for the civic issues API.
     */
    interface CivicApiService {
        @GET("issues/{issueId}")
        Call<WorkItemDto> getIssue(@Path("issueId") String issueId);

        @GET("issues/open-count")
        Call<CountDto> countOpen(@Query("department") String departmentId, @Query("worker") String workerId);

        @PUT("issues/{issueId}/assignment")
        Call<Void> updateAssignment(@Path("issueId") String issueId, @Body AssignmentUpdateDto request);

        @POST("issues/{issueId}/unassign")
        Call<Void> clearAssignment(@Path("issueId") String issueId, @Body TimelineEntryDto request);

        @GET("departments?active=true")
        Call<List<HandlingUnitDto>> getActiveDepartments();

        @POST("notifications")
        Call<Void> createNotification(@Body NotificationDto request);

        @POST("events")
        Call<Void> publishEvent(@Body EventDto request);
    }
}
