package com.platform.wafoperator.store.kubernetes;

import com.platform.wafoperator.error.AdmissionRejectedException;
import com.platform.wafoperator.error.ErrorCode;
import com.platform.wafoperator.error.MissingIdentityException;
import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.error.ResourceConflictException;
import com.platform.wafoperator.error.ResourceNotFoundException;
import com.platform.wafoperator.error.StoreUnavailableException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.store.ResourceClient;
import com.platform.wafoperator.store.WatchEvent;
import com.platform.wafoperator.store.WatchRegistration;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link ResourceClient} backed by the Kubernetes API server through
 * fabric8 generic resources.
 */
@Slf4j
class KubernetesResourceClient<T extends Resource<T>> implements ResourceClient<T> {
    
    private final KubernetesClient client;
    private final ResourceKind kind;
    private final ResourceMapper mapper;
    private final ResourceDefinitionContext context;
    
    KubernetesResourceClient(KubernetesClient client, ResourceKind kind, ResourceMapper mapper) {
        this.client = client;
        this.kind = kind;
        this.mapper = mapper;
        this.context = new ResourceDefinitionContext.Builder()
            .withGroup(kind.getGroup())
            .withVersion(kind.getVersion())
            .withKind(kind.getKindName())
            .withPlural(kind.getPlural())
            .withNamespaced(true)
            .build();
    }
    
    @Override
    public ResourceKind kind() {
        return kind;
    }
    
    @Override
    public Optional<T> get(ObjectKey key) {
        GenericKubernetesResource generic = call("get", key.toString(),
            () -> operation().inNamespace(key.namespace()).withName(key.name()).get());
        return Optional.ofNullable(generic).map(this::toTyped);
    }
    
    @Override
    public List<T> list(String namespace) {
        String target = namespace == null ? "all namespaces" : namespace;
        GenericKubernetesResourceList list = call("list", target, () -> namespace == null
            ? operation().inAnyNamespace().list()
            : operation().inNamespace(namespace).list());
        return list.getItems().stream().map(this::toTyped).toList();
    }
    
    @Override
    public T create(T resource) {
        ObjectKey key = identityOf(resource);
        GenericKubernetesResource created = call("create", key.toString(),
            () -> operation().inNamespace(key.namespace()).resource(mapper.toGeneric(resource)).create());
        return toTyped(created);
    }
    
    @Override
    public T update(T resource) {
        ObjectKey key = identityOf(resource);
        GenericKubernetesResource updated = call("update", key.toString(),
            () -> operation().inNamespace(key.namespace()).resource(mapper.toGeneric(resource)).update());
        return toTyped(updated);
    }
    
    @Override
    public T patchStatus(T resource) {
        ObjectKey key = identityOf(resource);
        GenericKubernetesResource patched = call("patch status of", key.toString(),
            () -> operation().inNamespace(key.namespace()).resource(mapper.toStatusPatch(resource)).patchStatus());
        return toTyped(patched);
    }
    
    @Override
    public void delete(ObjectKey key) {
        List<StatusDetails> details = call("delete", key.toString(),
            () -> operation().inNamespace(key.namespace()).withName(key.name()).delete());
        if (details == null || details.isEmpty()) {
            throw new ResourceNotFoundException(kind.getKindName(), key.toString());
        }
    }
    
    @Override
    public WatchRegistration watch(Consumer<WatchEvent<T>> listener) {
        SharedIndexInformer<GenericKubernetesResource> informer = call("watch", kind.getPlural(),
            () -> operation().inAnyNamespace().inform(new ResourceEventHandler<>() {
                @Override
                public void onAdd(GenericKubernetesResource obj) {
                    deliver(listener, obj, WatchEvent::added);
                }
                
                @Override
                public void onUpdate(GenericKubernetesResource oldObj, GenericKubernetesResource newObj) {
                    T previous = toTypedOrNull(oldObj);
                    deliver(listener, newObj, o -> WatchEvent.modified(previous, o));
                }
                
                @Override
                public void onDelete(GenericKubernetesResource obj, boolean deletedFinalStateUnknown) {
                    deliver(listener, obj, WatchEvent::deleted);
                }
            }));
        log.info("Started informer for {}", kind.getKindName());
        return () -> {
            informer.stop();
            log.info("Stopped informer for {}", kind.getKindName());
        };
    }
    
    private void deliver(Consumer<WatchEvent<T>> listener, GenericKubernetesResource obj,
            Function<T, WatchEvent<T>> eventFactory) {
        T typed = toTypedOrNull(obj);
        if (typed == null) {
            return;
        }
        try {
            listener.accept(eventFactory.apply(typed));
        } catch (RuntimeException e) {
            log.warn("Watch listener failed for {} {}: {}", kind.getKindName(), typed.key(), e.getMessage(), e);
        }
    }
    
    private T toTyped(GenericKubernetesResource generic) {
        return mapper.fromGeneric(kind, generic);
    }
    
    private T toTypedOrNull(GenericKubernetesResource generic) {
        if (generic == null) {
            return null;
        }
        try {
            return toTyped(generic);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unreadable {} {}/{}: {}", kind.getKindName(),
                generic.getMetadata().getNamespace(), generic.getMetadata().getName(), e.getMessage());
            return null;
        }
    }
    
    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList,
            io.fabric8.kubernetes.client.dsl.Resource<GenericKubernetesResource>> operation() {
        return client.genericKubernetesResources(context);
    }
    
    private ObjectKey identityOf(T resource) {
        if (resource.metadata() == null || resource.metadata().name() == null 
                || resource.metadata().name().isBlank()) {
            throw new MissingIdentityException(kind.getKindName() + " must have a name set");
        }
        return resource.key();
    }
    
    private <R> R call(String operation, String target, Supplier<R> request) {
        try {
            return request.get();
        } catch (KubernetesClientException e) {
            throw translate(operation, target, e);
        }
    }
    
    private OperatorException translate(String operation, String target, KubernetesClientException e) {
        String kindName = kind.getKindName();
        return switch (e.getCode()) {
            case 404 -> new ResourceNotFoundException(kindName, target);
            case 409 -> "create".equals(operation)
                ? ResourceConflictException.alreadyExists(kindName, target)
                : new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, kindName, target, e.getMessage());
            case 400, 422 -> new AdmissionRejectedException(e.getMessage());
            default -> StoreUnavailableException.requestFailed(operation, kindName + " " + target, e);
        };
    }
}
