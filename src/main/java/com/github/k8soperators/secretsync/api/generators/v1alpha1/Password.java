package com.github.k8soperators.secretsync.api.generators.v1alpha1;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

@Version("v1alpha1")
@Group("generators.secretsync.k8soperators.github.com")
public class Password extends CustomResource<PasswordSpec, Void> implements Namespaced {

    private static final long serialVersionUID = 1L;

}
