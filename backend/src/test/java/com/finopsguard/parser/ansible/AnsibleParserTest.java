package com.finopsguard.parser.ansible;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.parser.ParseException;
import com.finopsguard.parser.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnsibleParserTest {

    private AnsibleParser parser;

    @BeforeEach
    void setUp() {
        parser = new AnsibleParser(ParserFixtures.registry());
    }

    @Nested
    @DisplayName("Playbook Tests")
    class PlaybookTests {

        @Test
        @DisplayName("Should extract cloud modules and skip everything else")
        void shouldExtractCloudModules() {
            // Given
            String playbook = """
                    - hosts: localhost
                      vars:
                        aws_region: eu-central-1
                        size: m5.large
                      tasks:
                        - name: Launch web servers
                          amazon.aws.ec2_instance:
                            name: web
                            instance_type: "{{ size }}"
                            exact_count: 2
                        - name: Create GCE VM
                          google.cloud.gcp_compute_instance:
                            name: gce-vm
                            machine_type: n1-standard-4
                            zone: us-central1-b
                        - name: Say hello
                          debug:
                            msg: hi
                    """;

            // When
            CanonicalResourceModel model = parser.parse(playbook);

            // Then
            assertThat(model.size()).isEqualTo(2);
            CanonicalResource ec2 = model.getResources().get(0);
            assertThat(ec2.getType()).isEqualTo("aws_instance");
            assertThat(ec2.getName()).isEqualTo("web");
            assertThat(ec2.getSize()).isEqualTo("m5.large");
            assertThat(ec2.getCount()).isEqualTo(2);
            assertThat(ec2.getRegion()).isEqualTo("eu-central-1");

            CanonicalResource gce = model.getResources().get(1);
            assertThat(gce.getType()).isEqualTo("gcp_compute_instance");
            assertThat(gce.getSize()).isEqualTo("n1-standard-4");
            assertThat(gce.getRegion()).isEqualTo("us-central1");
        }

        @Test
        @DisplayName("Should descend into blocks and read Azure modules")
        void shouldDescendIntoBlocks() {
            // Given
            String playbook = """
                    - hosts: localhost
                      vars:
                        azure_location: West US 2
                      tasks:
                        - block:
                            - name: Create VM
                              azure_rm_virtualmachine:
                                name: api-vm
                                vm_size: Standard_D2s_v3
                          rescue:
                            - debug:
                                msg: failed
                    """;

            // When
            CanonicalResourceModel model = parser.parse(playbook);

            // Then
            assertThat(model.getResources()).hasSize(1);
            CanonicalResource vm = model.getResources().get(0);
            assertThat(vm.getType()).isEqualTo("azure_virtual_machine");
            assertThat(vm.getSize()).isEqualTo("Standard_D2s_v3");
            assertThat(vm.getRegion()).isEqualTo("westus2");
        }

        @Test
        @DisplayName("Should leave undefined variables unresolved and use defaults")
        void shouldKeepUndefinedVariables() {
            // Given
            String playbook = """
                    - hosts: localhost
                      tasks:
                        - ec2_instance:
                            name: worker
                            instance_type: "{{ undefined_size }}"
                    """;

            // When
            CanonicalResourceModel model = parser.parse(playbook);

            // Then
            assertThat(model.getResources().get(0).getSize()).isEqualTo("t3.micro");
            assertThat(model.getResources().get(0).getRegion()).isEqualTo("us-east-1");
        }
    }

    @Test
    @DisplayName("Should substitute a whole-value reference with its typed value")
    void shouldSubstituteTypedValue() {
        // When
        Object result = AnsibleParser.substitute("{{ replicas }}", Map.of("replicas", 3));

        // Then
        assertThat(result).isEqualTo(3);
    }

    @Test
    @DisplayName("Should substitute inside nested maps and stringify their keys")
    void shouldSubstituteNestedMaps() {
        // Given
        Map<Object, Object> args = new LinkedHashMap<>();
        args.put("instance_type", "{{ size }}");
        args.put(80, "http");

        // When
        Object result = AnsibleParser.substitute(Map.of("ec2", args), Map.of("size", "t3.large"));

        // Then
        assertThat(result).isEqualTo(Map.of("ec2", Map.of("instance_type", "t3.large", "80", "http")));
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> parser.parse("- hosts: [unclosed\n  tasks: {"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Malformed Ansible YAML");
    }
}
