package hookpoint.spring.boot;

import hookpoint.HookHandler;
import hookpoint.OwnerResolver;
import hookpoint.registry.HookRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.Map;

/**
 * Scans for beans annotated with {@link HookComponent} and registers them
 * in the {@link HookRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see HookComponent
 */
public class HookComponentRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final HookRegistry registry;
    private final OwnerResolver ownerResolver;

    public HookComponentRegistrar(ListableBeanFactory beanFactory, HookRegistry registry,
            OwnerResolver ownerResolver) {
        this.beanFactory = beanFactory;
        this.registry = registry;
        this.ownerResolver = ownerResolver;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(HookComponent.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof HookHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @HookComponent must implement HookHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Looks through proxies to the target class
            HookComponent annotation = beanFactory.findAnnotationOnBean(beanName, HookComponent.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @HookComponent annotation on " + bean.getClass().getName());
            }

            String hookName = annotation.hook().isEmpty() ? beanName : annotation.hook();
            String ownerId = annotation.owner().isEmpty() ? ownerResolver.resolve(handler) : annotation.owner();

            registry.register(hookName, handler, ownerId);
        }
    }
}
