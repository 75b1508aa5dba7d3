/** External error payloads and their JSON form. */
package express.mvp.myra.resilience.response;
