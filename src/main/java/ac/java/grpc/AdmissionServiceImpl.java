package ac.java.grpc;

import ac.core.capacity.CapacityGuard;
import ac.core.lock.LockTimeoutException;
import ac.core.model.Occupancy;
import ac.java.engine.AdmissionEngine;
import ac.java.engine.AdmissionResult;
import ac.java.engine.RoleKey;
import ac.java.store.DuplicateRegistrationException;
import ac.java.store.InMemoryRegistrationStore;
import ac.java.store.RegistrantKind;
import ac.java.store.RegistrationNotFoundException;
import ac.proto.AdmissionServiceGrpc;
import ac.proto.CancelRequest;
import ac.proto.CancelResponse;
import ac.proto.GetOccupancyRequest;
import ac.proto.GetOccupancyResponse;
import ac.proto.HealthCheckRequest;
import ac.proto.HealthCheckResponse;
import ac.proto.OccupancyView;
import ac.proto.RegisterRequest;
import ac.proto.RegisterResponse;
import ac.proto.SetCapacityRequest;
import ac.proto.SetCapacityResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC service implementation for role admission.
 *
 * <p>This is a thin wrapper over AdmissionEngine with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Lock timeout mapped to UNAVAILABLE so clients retry</li>
 *   <li>Duplicate sign-up mapped to ALREADY_EXISTS, unknown cancellation to NOT_FOUND</li>
 *   <li>A full role reported in the response, not as an error</li>
 *   <li>Capacity changes serialized with sign-ups on the role's lock</li>
 * </ul>
 *
 * <p>Thread-safety: the engine and store handle concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    static final String BUSY_MESSAGE = "Service temporarily unavailable due to high load. Please try again.";

    private final AdmissionEngine engine;
    private final InMemoryRegistrationStore store;

    /**
     * Creates a new gRPC service over the given engine and store.
     *
     * @param engine Admission engine (must be thread-safe)
     * @param store Store the engine's counting sources read from
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionServiceImpl(AdmissionEngine engine, InMemoryRegistrationStore store) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.engine = engine;
        this.store = store;
    }

    @Override
    public void register(RegisterRequest request, StreamObserver<RegisterResponse> responseObserver) {
        try {
            if (request.getEventId().isEmpty() || request.getRoleId().isEmpty()) {
                responseObserver.onError(invalid("event_id and role_id must not be empty"));
                return;
            }
            if (request.getRegistrantId().isEmpty()) {
                responseObserver.onError(invalid("registrant_id must not be empty"));
                return;
            }
            RegistrantKind kind = toKind(request.getKind());
            if (kind == null) {
                responseObserver.onError(invalid("kind must be MEMBER or GUEST, got: " + request.getKind()));
                return;
            }

            String key = RoleKey.of(request.getEventId(), request.getRoleId()).asString();
            AdmissionResult<Void> result = engine.admit(key, observed -> {
                store.register(key, request.getRegistrantId(), kind);
                return null;
            });

            switch (result.decision()) {
                case ADMITTED, FULL -> {
                    RegisterResponse response = RegisterResponse.newBuilder()
                        .setOutcome(result.isAdmitted()
                            ? RegisterResponse.Outcome.ADMITTED
                            : RegisterResponse.Outcome.FULL)
                        .setOccupancy(toView(result.occupancy()))
                        .build();
                    responseObserver.onNext(response);
                    responseObserver.onCompleted();
                }
                case BUSY -> responseObserver.onError(
                    Status.UNAVAILABLE.withDescription(BUSY_MESSAGE).asRuntimeException());
            }

        } catch (DuplicateRegistrationException e) {
            responseObserver.onError(
                Status.ALREADY_EXISTS.withDescription(e.getMessage()).asRuntimeException());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            responseObserver.onError(
                Status.CANCELLED.withDescription("Interrupted while waiting for role lock").asRuntimeException());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalid(e.getMessage()));
        } catch (Exception e) {
            log.error("Register failed for event={} role={}", request.getEventId(), request.getRoleId(), e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void cancel(CancelRequest request, StreamObserver<CancelResponse> responseObserver) {
        try {
            if (request.getEventId().isEmpty() || request.getRoleId().isEmpty()
                || request.getRegistrantId().isEmpty()) {
                responseObserver.onError(invalid("event_id, role_id and registrant_id must not be empty"));
                return;
            }

            String key = RoleKey.of(request.getEventId(), request.getRoleId()).asString();
            RegistrantKind removed = engine.withdraw(key, () -> store.remove(key, request.getRegistrantId()));

            responseObserver.onNext(CancelResponse.newBuilder().setKind(toProto(removed)).build());
            responseObserver.onCompleted();

        } catch (RegistrationNotFoundException e) {
            responseObserver.onError(Status.NOT_FOUND.withDescription(e.getMessage()).asRuntimeException());
        } catch (LockTimeoutException e) {
            responseObserver.onError(
                Status.UNAVAILABLE.withDescription(BUSY_MESSAGE).withCause(e).asRuntimeException());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            responseObserver.onError(
                Status.CANCELLED.withDescription("Interrupted while waiting for role lock").asRuntimeException());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalid(e.getMessage()));
        } catch (Exception e) {
            log.error("Cancel failed for event={} role={}", request.getEventId(), request.getRoleId(), e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void getOccupancy(GetOccupancyRequest request, StreamObserver<GetOccupancyResponse> responseObserver) {
        try {
            if (request.getEventId().isEmpty() || request.getRoleId().isEmpty()) {
                responseObserver.onError(invalid("event_id and role_id must not be empty"));
                return;
            }

            Occupancy occupancy = engine.occupancy(RoleKey.of(request.getEventId(), request.getRoleId()).asString());
            GetOccupancyResponse response = GetOccupancyResponse.newBuilder()
                .setOccupancy(toView(occupancy))
                .setFull(CapacityGuard.isRoleFull(occupancy))
                .build();

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalid(e.getMessage()));
        } catch (Exception e) {
            log.error("GetOccupancy failed for event={} role={}", request.getEventId(), request.getRoleId(), e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void setCapacity(SetCapacityRequest request, StreamObserver<SetCapacityResponse> responseObserver) {
        try {
            if (request.getEventId().isEmpty() || request.getRoleId().isEmpty()) {
                responseObserver.onError(invalid("event_id and role_id must not be empty"));
                return;
            }
            if (!request.getUnbounded() && request.getCapacity() < 0) {
                responseObserver.onError(invalid("capacity must be >= 0, got: " + request.getCapacity()));
                return;
            }

            String key = RoleKey.of(request.getEventId(), request.getRoleId()).asString();
            engine.reconfigure(key, () -> {
                if (request.getUnbounded()) {
                    store.clearCapacity(key);
                } else {
                    store.setCapacity(key, request.getCapacity());
                }
                return null;
            });

            Occupancy occupancy = engine.occupancy(key);
            responseObserver.onNext(SetCapacityResponse.newBuilder()
                .setOccupancy(toView(occupancy))
                .setFull(CapacityGuard.isRoleFull(occupancy))
                .build());
            responseObserver.onCompleted();

        } catch (LockTimeoutException e) {
            responseObserver.onError(
                Status.UNAVAILABLE.withDescription(BUSY_MESSAGE).withCause(e).asRuntimeException());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            responseObserver.onError(
                Status.CANCELLED.withDescription("Interrupted while waiting for role lock").asRuntimeException());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(invalid(e.getMessage()));
        } catch (Exception e) {
            log.error("SetCapacity failed for event={} role={}", request.getEventId(), request.getRoleId(), e);
            responseObserver.onError(internal(e));
        }
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        // If we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static OccupancyView toView(Occupancy occupancy) {
        OccupancyView.Builder view = OccupancyView.newBuilder()
            .setCurrent(occupancy.current())
            .setUnbounded(!occupancy.isBounded());
        if (occupancy.isBounded()) {
            view.setLimit(occupancy.limit());
        }
        return view.build();
    }

    private static RegistrantKind toKind(ac.proto.RegistrantKind kind) {
        return switch (kind) {
            case MEMBER -> RegistrantKind.MEMBER;
            case GUEST -> RegistrantKind.GUEST;
            default -> null;
        };
    }

    private static ac.proto.RegistrantKind toProto(RegistrantKind kind) {
        return switch (kind) {
            case MEMBER -> ac.proto.RegistrantKind.MEMBER;
            case GUEST -> ac.proto.RegistrantKind.GUEST;
        };
    }

    private static RuntimeException invalid(String description) {
        return Status.INVALID_ARGUMENT.withDescription(description).asRuntimeException();
    }

    private static RuntimeException internal(Exception e) {
        return Status.INTERNAL
            .withDescription("Internal error: " + e.getMessage())
            .withCause(e)
            .asRuntimeException();
    }
}
